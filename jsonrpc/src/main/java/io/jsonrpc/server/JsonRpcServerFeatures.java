/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.jsonrpc.util.Assert;

/**
 * 服务器可以导出的方法的规范。
 */
public class JsonRpcServerFeatures {

	/**
	 * 一个已注册方法的描述：名称、按位置排列的输入参数、按位置排列的输出以及处理器。
	 *
	 * <p>
	 * 输出中不允许出现 {@link Throwable} 类型：错误只能通过处理器抛出的异常报告，不能占用结果位置。
	 *
	 * <pre>{@code
	 * var spec = MethodSpecification.builder("SayHello")
	 * 	.param(String.class)
	 * 	.returns(String.class)
	 * 	.handler(args -> args.get(0))
	 * 	.build();
	 * }</pre>
	 *
	 * @param name 线上方法名
	 * @param parameters 输入参数描述
	 * @param outputs 输出类型；为空表示结果为 {@code null}
	 * @param handler 处理器
	 */
	public record MethodSpecification(String name, List<ParameterSpec> parameters, List<JavaType> outputs,
			MethodHandler handler) {

		public MethodSpecification {
			Assert.hasText(name, "Method name must not be empty");
			Assert.notNull(parameters, "Parameters must not be null");
			Assert.notNull(outputs, "Outputs must not be null");
			Assert.notNull(handler, "Handler must not be null");
			for (JavaType output : outputs) {
				Assert.notNull(output, "Output type must not be null");
				Assert.isTrue(!output.isTypeOrSubTypeOf(Throwable.class),
						"Method " + name + " declares an error type as a result: " + output);
			}
			parameters = List.copyOf(parameters);
			outputs = List.copyOf(outputs);
		}

		public static Builder builder(String name) {
			return new Builder(name);
		}

	}

	/**
	 * {@link MethodSpecification} 的构建器。
	 */
	public static class Builder {

		private final TypeFactory typeFactory = TypeFactory.defaultInstance();

		private final String name;

		private final List<ParameterSpec> parameters = new ArrayList<>();

		private final List<JavaType> outputs = new ArrayList<>();

		private MethodHandler handler;

		private Builder(String name) {
			this.name = name;
		}

		public Builder param(Class<?> type) {
			return param(this.typeFactory.constructType(type));
		}

		public Builder param(TypeReference<?> type) {
			return param(this.typeFactory.constructType(type));
		}

		public Builder param(JavaType type) {
			this.parameters.add(ParameterSpec.required(type));
			return this;
		}

		/**
		 * 添加一个可选参数。调用方省略它时，处理器收到该类型的缺省值。
		 */
		public Builder optionalParam(Class<?> type) {
			return optionalParam(this.typeFactory.constructType(type));
		}

		public Builder optionalParam(TypeReference<?> type) {
			return optionalParam(this.typeFactory.constructType(type));
		}

		public Builder optionalParam(JavaType type) {
			this.parameters.add(ParameterSpec.optional(type));
			return this;
		}

		public Builder returns(Class<?>... types) {
			for (Class<?> type : types) {
				this.outputs.add(this.typeFactory.constructType(type));
			}
			return this;
		}

		public Builder returns(JavaType... types) {
			this.outputs.addAll(List.of(types));
			return this;
		}

		public Builder handler(MethodHandler handler) {
			this.handler = handler;
			return this;
		}

		public MethodSpecification build() {
			return new MethodSpecification(this.name, this.parameters, this.outputs, this.handler);
		}

	}

}
