/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client;

import java.time.Duration;

import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 阻塞式JSON-RPC客户端，是对 {@link JsonRpcAsyncClient} 的包装。
 *
 * <pre>{@code
 * Reply reply = client.call("SayHello", "Hello");
 * String greeting = reply.join(String.class);
 * }</pre>
 *
 * @see JsonRpcClient
 * @see Reply
 */
public class JsonRpcSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcSyncClient.class);

	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final JsonRpcAsyncClient delegate;

	JsonRpcSyncClient(JsonRpcAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	/**
	 * 准备一次调用。请求在 {@link Reply#join()} 时发送。
	 * @param method 方法名
	 * @param args 按位置排列的参数
	 * @return 待处理句柄
	 */
	public Reply call(String method, Object... args) {
		Assert.hasText(method, "Method must not be empty");
		return new Reply(this.delegate, method, args);
	}

	/**
	 * 发送通知，阻塞到传输层接受它为止。
	 */
	public void sendNotification(String method, Object... args) {
		this.delegate.sendNotification(method, args).block();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	/**
	 * 获取底层的异步客户端。
	 */
	public JsonRpcAsyncClient async() {
		return this.delegate;
	}

}
