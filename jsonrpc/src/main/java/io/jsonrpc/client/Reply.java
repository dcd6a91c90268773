/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client;

import java.util.Arrays;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrpc.spec.JsonRpcException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 同步调用的待处理句柄。
 *
 * <p>
 * 请求在 {@code join} 时才发送，调用线程阻塞直到响应到达、超时、客户端关闭或 {@link #cancel()} 被调用。
 * {@code cancel} 可以在任何线程上、在 {@code join} 之前或期间调用；被取消的 {@code join} 立即以
 * {@link JsonRpcException.Kind#CANCELLED} 失败，不会等到超时。
 *
 * <p>
 * 每个 {@code Reply} 只能 {@code join} 一次。
 */
public final class Reply {

	private final JsonRpcAsyncClient client;

	private final String method;

	private final Object[] args;

	private final Sinks.Empty<Void> cancelSignal = Sinks.empty();

	Reply(JsonRpcAsyncClient client, String method, Object[] args) {
		this.client = client;
		this.method = method;
		this.args = (args != null) ? args.clone() : new Object[0];
	}

	/**
	 * 发送请求并等待原始结果。
	 * @return 结果；远程结果为 {@code null} 时返回null
	 * @throws JsonRpcException 超时、取消、关闭、传输失败或对端返回错误时
	 */
	public JsonNode join() {
		return this.client.call(this.method, Arrays.asList(this.args), this.cancelSignal.asMono()).block();
	}

	public <T> T join(Class<T> resultType) {
		return join(this.client.getObjectMapper().constructType(resultType));
	}

	public <T> T join(TypeReference<T> resultType) {
		return join(this.client.getObjectMapper().getTypeFactory().constructType(resultType));
	}

	private <T> T join(JavaType resultType) {
		Mono<T> result = this.client.call(resultType, this.method, Arrays.asList(this.args),
				this.cancelSignal.asMono());
		return result.block();
	}

	/**
	 * 取消调用。对已完成的调用没有影响。
	 */
	public void cancel() {
		this.cancelSignal.tryEmitEmpty();
	}

	public String method() {
		return this.method;
	}

}
