/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.util.Optional;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.databind.util.ClassUtil;
import io.jsonrpc.util.Assert;

/**
 * 处理器的一个按位置排列的输入参数描述。
 *
 * <p>
 * 可选参数在请求的 {@code params} 数组中缺失（或为 {@code null}）时以缺省值填充：
 * {@link Optional} 类型填充 {@link Optional#empty()}，基本类型填充其零值，其他类型填充
 * {@code null}。必需参数缺失是一个 InvalidParams 错误。
 *
 * @param type 参数声明的类型
 * @param kind 必需或可选
 */
public record ParameterSpec(JavaType type, Kind kind) {

	public enum Kind {

		REQUIRED, OPTIONAL

	}

	public ParameterSpec {
		Assert.notNull(type, "Parameter type must not be null");
		Assert.notNull(kind, "Parameter kind must not be null");
	}

	public static ParameterSpec required(JavaType type) {
		return new ParameterSpec(type, Kind.REQUIRED);
	}

	public static ParameterSpec optional(JavaType type) {
		return new ParameterSpec(type, Kind.OPTIONAL);
	}

	public boolean isOptional() {
		return this.kind == Kind.OPTIONAL;
	}

	boolean isOptionalWrapper() {
		return this.type.getRawClass() == Optional.class;
	}

	/**
	 * 线上值实际要解码成的类型。对于 {@code Optional<T>} 是 {@code T}。
	 */
	JavaType valueType() {
		if (!isOptionalWrapper()) {
			return this.type;
		}
		JavaType contained = this.type.containedType(0);
		return (contained != null) ? contained : TypeFactory.unknownType();
	}

	Object absentValue() {
		if (isOptionalWrapper()) {
			return Optional.empty();
		}
		Class<?> raw = this.type.getRawClass();
		return raw.isPrimitive() ? ClassUtil.defaultValue(raw) : null;
	}

	Object wrap(Object decoded) {
		return isOptionalWrapper() ? Optional.ofNullable(decoded) : decoded;
	}

}
