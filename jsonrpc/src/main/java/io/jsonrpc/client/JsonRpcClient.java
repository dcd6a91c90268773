/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.spec.JsonRpcClientTransport;
import io.jsonrpc.util.Assert;

/**
 * 用于创建JSON-RPC客户端的工厂类。
 *
 * <p>
 * 该类提供工厂方法来创建以下两种客户端：
 * <ul>
 * <li>{@link JsonRpcSyncClient} 用于阻塞调用，通过 {@link Reply} 等待结果
 * <li>{@link JsonRpcAsyncClient} 用于基于Reactor的非阻塞调用
 * </ul>
 *
 * <p>
 * 两种客户端共享同一个关联引擎：每个客户端实例拥有一个接收循环、一个待处理调用表和一个从1开始的请求序号。
 * 接收循环结束后客户端不可再用，需要重新创建。
 *
 * <p>
 * 创建基本同步客户端的示例：<pre>{@code
 * JsonRpcSyncClient client = JsonRpcClient.sync(transport)
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .build();
 *
 * String greeting = client.call("SayHello", "Hello").join(String.class);
 * }</pre>
 *
 * 创建基本异步客户端的示例：<pre>{@code
 * JsonRpcAsyncClient client = JsonRpcClient.async(transport).build();
 *
 * client.call(String.class, "SayHello", "Hello")
 *     .subscribe(greeting -> System.out.println(greeting));
 * }</pre>
 *
 * @see JsonRpcAsyncClient
 * @see JsonRpcSyncClient
 * @see JsonRpcClientTransport
 */
public interface JsonRpcClient {

	/** 单次调用的默认超时 */
	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

	/**
	 * 开始构建同步客户端。
	 * @param transport 客户端传输
	 * @return 用于配置客户端的新 {@link SyncSpec}
	 */
	static SyncSpec sync(JsonRpcClientTransport transport) {
		return new SyncSpec(transport);
	}

	/**
	 * 开始构建异步客户端。
	 * @param transport 客户端传输
	 * @return 用于配置客户端的新 {@link AsyncSpec}
	 */
	static AsyncSpec async(JsonRpcClientTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * 同步客户端规范。
	 */
	class SyncSpec {

		private final JsonRpcClientTransport transport;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private ObjectMapper objectMapper;

		private SyncSpec(JsonRpcClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * 设置等待响应的时长。超过该时长仍未收到响应的调用以超时错误结束。
		 * @param requestTimeout 超时时长，必须为正
		 * @return 此构建器实例
		 */
		public SyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public SyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 创建客户端并启动接收循环。
		 * @return 新的 {@link JsonRpcSyncClient}
		 */
		public JsonRpcSyncClient build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new JsonRpcSyncClient(new JsonRpcAsyncClient(this.transport, this.requestTimeout, mapper));
		}

	}

	/**
	 * 异步客户端规范。
	 */
	class AsyncSpec {

		private final JsonRpcClientTransport transport;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private ObjectMapper objectMapper;

		private AsyncSpec(JsonRpcClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public AsyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public JsonRpcAsyncClient build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new JsonRpcAsyncClient(this.transport, this.requestTimeout, mapper);
		}

	}

}
