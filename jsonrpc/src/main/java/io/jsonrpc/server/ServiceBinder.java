/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 在启动时扫描服务对象上带有 {@link JsonRpcMethod} 注解的方法，并为每个方法生成一个
 * {@link JsonRpcServerFeatures.MethodSpecification}。
 *
 * <p>
 * 反射只在这里发生一次：每个方法被解析为绑定到服务对象的 {@link MethodHandle}，请求路径上只调用句柄。
 * 类型为 {@link Optional} 的参数是可选参数。返回 {@link Throwable} 的方法和重名的方法会被拒绝。
 *
 * <pre>{@code
 * public class Greeter {
 *
 * 	&#64;JsonRpcMethod("SayHello")
 * 	public String sayHello(String name) {
 * 		return name;
 * 	}
 *
 * }
 *
 * List<MethodSpecification> methods = ServiceBinder.bind(new Greeter());
 * }</pre>
 */
public final class ServiceBinder {

	private static final Logger logger = LoggerFactory.getLogger(ServiceBinder.class);

	private ServiceBinder() {
	}

	public static List<JsonRpcServerFeatures.MethodSpecification> bind(Object service) {
		return bind(service, TypeFactory.defaultInstance());
	}

	/**
	 * 绑定服务对象导出的所有方法。
	 * @param service 服务对象
	 * @param typeFactory 用于解析参数和返回类型的TypeFactory
	 * @return 方法规范，按名称排序
	 * @throws IllegalArgumentException 如果服务没有导出任何方法，或某个方法的声明无效
	 */
	public static List<JsonRpcServerFeatures.MethodSpecification> bind(Object service, TypeFactory typeFactory) {
		Assert.notNull(service, "Service must not be null");
		Assert.notNull(typeFactory, "TypeFactory must not be null");

		List<JsonRpcServerFeatures.MethodSpecification> specifications = new ArrayList<>();
		Set<String> names = new HashSet<>();
		for (Method method : service.getClass().getMethods()) {
			JsonRpcMethod annotation = method.getAnnotation(JsonRpcMethod.class);
			if (annotation == null || method.isBridge() || method.isSynthetic()) {
				continue;
			}
			String name = annotation.value().isEmpty() ? method.getName() : annotation.value();
			if (!names.add(name)) {
				throw new IllegalArgumentException(
						"Duplicate JSON-RPC method name '" + name + "' on " + service.getClass().getName());
			}
			specifications.add(bindMethod(service, method, name, typeFactory));
		}

		Assert.notEmpty(specifications,
				"Service " + service.getClass().getName() + " does not export any @JsonRpcMethod methods");
		specifications.sort(Comparator.comparing(JsonRpcServerFeatures.MethodSpecification::name));
		return specifications;
	}

	private static JsonRpcServerFeatures.MethodSpecification bindMethod(Object service, Method method, String name,
			TypeFactory typeFactory) {

		Assert.isTrue(!Modifier.isStatic(method.getModifiers()),
				"JSON-RPC method " + method + " must be an instance method");
		Assert.isTrue(!Throwable.class.isAssignableFrom(method.getReturnType()),
				"JSON-RPC method " + method + " must not return an error type");

		List<ParameterSpec> parameters = new ArrayList<>();
		for (Type parameterType : method.getGenericParameterTypes()) {
			JavaType type = typeFactory.constructType(parameterType);
			parameters.add((type.getRawClass() == Optional.class) ? ParameterSpec.optional(type)
					: ParameterSpec.required(type));
		}

		List<JavaType> outputs = (method.getReturnType() == void.class) ? List.of()
				: List.of(typeFactory.constructType(method.getGenericReturnType()));

		MethodHandle handle = unreflect(method).bindTo(service);
		logger.debug("Bound JSON-RPC method {} to {}", name, method);

		return new JsonRpcServerFeatures.MethodSpecification(name, parameters, outputs,
				arguments -> invoke(handle, arguments));
	}

	private static MethodHandle unreflect(Method method) {
		try {
			method.setAccessible(true);
			return MethodHandles.lookup().unreflect(method);
		}
		catch (IllegalAccessException | RuntimeException e) {
			throw new IllegalArgumentException("Cannot access JSON-RPC method " + method, e);
		}
	}

	private static Object invoke(MethodHandle handle, List<Object> arguments) throws Exception {
		try {
			return handle.invokeWithArguments(arguments);
		}
		catch (Exception | Error e) {
			throw e;
		}
		catch (Throwable t) {
			throw new UndeclaredThrowableException(t);
		}
	}

}
