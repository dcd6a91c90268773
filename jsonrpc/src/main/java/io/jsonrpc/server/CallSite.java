/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jsonrpc.spec.JsonRpcError;
import io.jsonrpc.util.Assert;

/**
 * 方法名与其处理器之间已解析、可复用的绑定。
 *
 * <p>
 * 创建后不可变，因此可以被任意多个分发任务同时使用。每个参数的 {@link ObjectReader}
 * 在创建时解析一次。
 */
public final class CallSite {

	private final String name;

	private final List<ParameterSpec> parameters;

	private final List<ObjectReader> readers;

	private final List<JavaType> outputs;

	private final MethodHandler handler;

	private final ObjectMapper objectMapper;

	CallSite(JsonRpcServerFeatures.MethodSpecification specification, ObjectMapper objectMapper) {
		Assert.notNull(specification, "Specification must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.name = specification.name();
		this.parameters = specification.parameters();
		this.outputs = specification.outputs();
		this.handler = specification.handler();
		this.objectMapper = objectMapper;

		List<ObjectReader> readers = new ArrayList<>(this.parameters.size());
		for (ParameterSpec parameter : this.parameters) {
			readers.add(objectMapper.readerFor(parameter.valueType()));
		}
		this.readers = List.copyOf(readers);
	}

	public String name() {
		return this.name;
	}

	public List<ParameterSpec> parameters() {
		return this.parameters;
	}

	public List<JavaType> outputs() {
		return this.outputs;
	}

	/**
	 * 将线上的 {@code params} 按位置绑定到声明的参数。
	 * @param params 请求的 {@code params}；缺省或 {@code null} 视为空数组
	 * @return 解码后的参数，长度等于声明的参数个数
	 * @throws JsonRpcError InvalidParams，消息指明出错的位置
	 */
	List<Object> bind(JsonNode params) {
		if (params != null && !params.isNull() && !params.isArray()) {
			throw JsonRpcError.invalidParams("non-array args");
		}
		int supplied = (params == null || params.isNull()) ? 0 : params.size();
		if (supplied > this.parameters.size()) {
			throw JsonRpcError.invalidParams("too many arguments, want at most " + this.parameters.size());
		}

		List<Object> arguments = new ArrayList<>(this.parameters.size());
		for (int i = 0; i < this.parameters.size(); i++) {
			ParameterSpec parameter = this.parameters.get(i);
			JsonNode element = (i < supplied) ? params.get(i) : null;
			if (element == null || element.isNull()) {
				if (!parameter.isOptional()) {
					throw JsonRpcError.invalidParams("missing value for required argument " + i);
				}
				arguments.add(parameter.absentValue());
				continue;
			}
			try {
				Object value = this.readers.get(i).readValue(element);
				arguments.add(parameter.wrap(value));
			}
			catch (IOException | IllegalArgumentException e) {
				String reason = (e instanceof JsonProcessingException jpe) ? jpe.getOriginalMessage() : e.getMessage();
				throw JsonRpcError.invalidParams("invalid value for argument " + i + ": " + reason);
			}
		}
		return arguments;
	}

	/**
	 * 调用处理器并编码其结果。
	 * @throws Exception 处理器抛出的异常，原样传播
	 */
	JsonNode invoke(List<Object> arguments) throws Exception {
		Object value = this.handler.handle(arguments);
		return encodeResult(value);
	}

	private JsonNode encodeResult(Object value) {
		try {
			if (this.outputs.isEmpty()) {
				return NullNode.instance;
			}
			if (this.outputs.size() == 1) {
				return this.objectMapper.valueToTree(value);
			}
			List<?> values = asList(value);
			ArrayNode results = this.objectMapper.createArrayNode();
			for (Object element : values) {
				results.add((JsonNode) this.objectMapper.valueToTree(element));
			}
			return results;
		}
		catch (IllegalArgumentException e) {
			throw JsonRpcError.internalError("failed to encode result of " + this.name + ": " + e.getMessage());
		}
	}

	private List<?> asList(Object value) {
		List<?> values;
		if (value instanceof List<?> list) {
			values = list;
		}
		else if (value != null && value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> elements = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				elements.add(Array.get(value, i));
			}
			values = elements;
		}
		else {
			throw new IllegalArgumentException("expected " + this.outputs.size() + " results but got " + value);
		}
		if (values.size() != this.outputs.size()) {
			throw new IllegalArgumentException(
					"expected " + this.outputs.size() + " results but got " + values.size());
		}
		return values;
	}

	@Override
	public String toString() {
		return "CallSite[" + this.name + ", parameters=" + this.parameters.size() + ", outputs="
				+ this.outputs.size() + "]";
	}

}
