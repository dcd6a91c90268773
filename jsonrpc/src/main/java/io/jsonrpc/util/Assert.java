/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.util;

import java.util.Collection;

import reactor.util.annotation.Nullable;

/**
 * 构建器和注册阶段使用的参数校验工具。校验失败一律抛出 {@link IllegalArgumentException}，
 * 因此配置错误会在服务器或客户端启动前暴露，而不是在请求路径上。
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * 断言对象不为 {@code null}。
	 *
	 * <pre class="code">
	 * Assert.notNull(transport, "The transport can not be null");
	 * </pre>
	 * @param object 要检查的对象
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果对象为 {@code null}
	 */
	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言字符串包含至少一个非空白字符。
	 * @param text 要检查的字符串
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果文本为 {@code null} 或仅包含空白
	 */
	public static void hasText(@Nullable String text, String message) {
		if (!Utils.hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言集合不为 {@code null} 且不为空。
	 * @param collection 要检查的集合
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果集合为 {@code null} 或为空
	 */
	public static void notEmpty(@Nullable Collection<?> collection, String message) {
		if (Utils.isEmpty(collection)) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言布尔表达式为 {@code true}。
	 * @param expression 要检查的表达式
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果表达式为 {@code false}
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
