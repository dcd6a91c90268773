/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.spec.JsonRpcError;
import io.jsonrpc.spec.JsonRpcSchema.JSONRPCResponse;
import io.jsonrpc.spec.JsonRpcServerTransport;
import io.jsonrpc.spec.JsonRpcServerTransport.InboundFrame;
import io.jsonrpc.util.Assert;
import io.jsonrpc.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * JSON-RPC服务器运行时。
 *
 * <p>
 * 服务器拥有一个 {@link JsonRpcServerTransport} 和一个 {@link JsonRpcDispatcher}。唯一的接收循环读取入站帧，
 * 并为每个帧启动一个独立的分发任务，因此慢处理器不会阻塞后续帧的接收。每个分发任务在配置的调度器上执行，
 * 并受单次分发超时限制；请求的响应通过与该帧绑定的应答路径写回。
 *
 * <p>
 * 无法解析的帧只写入日志并丢弃，不会中止接收循环。
 *
 * <p>
 * 创建基本服务器的示例：<pre>{@code
 * JsonRpcServer server = JsonRpcServer.builder(transport)
 *     .service(new Greeter())
 *     .method(MethodSpecification.builder("Add")
 *         .param(int.class)
 *         .param(int.class)
 *         .returns(int.class)
 *         .handler(args -> (int) args.get(0) + (int) args.get(1))
 *         .build())
 *     .dispatchTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 *
 * @see JsonRpcServerTransport
 * @see ServiceBinder
 */
public class JsonRpcServer {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcServer.class);

	private static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofSeconds(60);

	private final JsonRpcServerTransport transport;

	private final ObjectMapper objectMapper;

	private final CallSiteRegistry registry;

	private final JsonRpcDispatcher dispatcher;

	private final Duration dispatchTimeout;

	private final Scheduler scheduler;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private final Disposable receiveLoop;

	JsonRpcServer(JsonRpcServerTransport transport, ObjectMapper objectMapper,
			List<JsonRpcServerFeatures.MethodSpecification> methods, Duration dispatchTimeout, Scheduler scheduler) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.dispatchTimeout = dispatchTimeout;
		this.scheduler = scheduler;
		this.registry = new CallSiteRegistry(objectMapper);
		methods.forEach(this.registry::register);
		this.dispatcher = new JsonRpcDispatcher(this.registry, objectMapper);

		logger.info("Starting JSON-RPC server with methods {}", this.registry.methodNames());
		this.receiveLoop = this.transport.receiveFrames()
			.flatMap(this::handleFrame, Integer.MAX_VALUE)
			.subscribe(null, error -> logger.error("Server receive loop failed", error),
					() -> logger.info("Server receive loop completed"));
	}

	/**
	 * 开始构建服务器。
	 * @param transport 服务器端传输
	 * @return 新的 {@link Builder}
	 */
	public static Builder builder(JsonRpcServerTransport transport) {
		return new Builder(transport);
	}

	private Mono<Void> handleFrame(InboundFrame frame) {
		return Mono.defer(() -> {
			JsonNode message;
			try {
				message = this.objectMapper.readTree(frame.payload());
			}
			catch (IOException e) {
				logger.warn("Dropping malformed frame {}: {}", Utils.preview(frame.payload()), e.getMessage());
				return frame.complete();
			}
			if (message == null || message.isMissingNode()) {
				logger.warn("Dropping empty frame");
				return frame.complete();
			}

			JsonNode id = JsonRpcDispatcher.requestId(message);
			String method = message.path("method").asText();
			logger.debug("Received frame {}", message);

			return this.dispatcher.dispatch(message)
				.subscribeOn(this.scheduler)
				.timeout(this.dispatchTimeout, Mono.defer(() -> onDispatchTimeout(id, method)))
				.map(Optional::of)
				.defaultIfEmpty(Optional.empty())
				.flatMap(response -> response.isPresent() ? frame.reply(this.dispatcher.encode(response.get()))
						: frame.complete());
		}).onErrorResume(error -> {
			logger.error("Failed to handle frame {}", Utils.preview(frame.payload()), error);
			return frame.complete();
		});
	}

	private Mono<JSONRPCResponse> onDispatchTimeout(JsonNode id, String method) {
		if (id == null) {
			logger.warn("Notification {} timed out after {}", method, this.dispatchTimeout);
			return Mono.empty();
		}
		logger.warn("Dispatch of {} (id {}) timed out after {}", method, id, this.dispatchTimeout);
		return Mono.just(JSONRPCResponse.failure(id,
				JsonRpcError.internalError("dispatch of " + method + " timed out").getJsonRpcError()));
	}

	/**
	 * 在运行时注册方法。
	 * @param specification 方法规范
	 * @throws IllegalArgumentException 如果同名方法已经注册
	 */
	public void addMethod(JsonRpcServerFeatures.MethodSpecification specification) {
		Assert.isTrue(!this.closed.get(), "Server is closed");
		this.registry.register(specification);
		logger.debug("Added method {} at runtime", specification.name());
	}

	public Set<String> methodNames() {
		return this.registry.methodNames();
	}

	public JsonRpcDispatcher getDispatcher() {
		return this.dispatcher;
	}

	/**
	 * 停止接收循环，取消进行中的分发，并优雅地关闭传输。
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.closed.compareAndSet(false, true)) {
				return Mono.empty();
			}
			this.receiveLoop.dispose();
			return this.transport.closeGracefully();
		});
	}

	public void close() {
		if (this.closed.compareAndSet(false, true)) {
			this.receiveLoop.dispose();
			this.transport.close();
		}
	}

	/**
	 * {@link JsonRpcServer} 的构建器。
	 */
	public static class Builder {

		private final JsonRpcServerTransport transport;

		private final List<JsonRpcServerFeatures.MethodSpecification> methods = new ArrayList<>();

		private final List<Object> services = new ArrayList<>();

		private ObjectMapper objectMapper;

		private Duration dispatchTimeout = DEFAULT_DISPATCH_TIMEOUT;

		private Scheduler scheduler = Schedulers.boundedElastic();

		private Builder(JsonRpcServerTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public Builder method(JsonRpcServerFeatures.MethodSpecification specification) {
			Assert.notNull(specification, "Method specification must not be null");
			this.methods.add(specification);
			return this;
		}

		public Builder methods(List<JsonRpcServerFeatures.MethodSpecification> specifications) {
			Assert.notNull(specifications, "Method specifications must not be null");
			specifications.forEach(this::method);
			return this;
		}

		public Builder methods(JsonRpcServerFeatures.MethodSpecification... specifications) {
			return methods(Arrays.asList(specifications));
		}

		/**
		 * 导出服务对象上所有带 {@link JsonRpcMethod} 注解的方法。
		 * @see ServiceBinder
		 */
		public Builder service(Object service) {
			Assert.notNull(service, "Service must not be null");
			this.services.add(service);
			return this;
		}

		/**
		 * 设置单次分发的超时时间。超时的请求以 InternalError 应答，超时的通知只写入日志。
		 */
		public Builder dispatchTimeout(Duration dispatchTimeout) {
			Assert.notNull(dispatchTimeout, "Dispatch timeout must not be null");
			Assert.isTrue(!dispatchTimeout.isNegative() && !dispatchTimeout.isZero(),
					"Dispatch timeout must be positive");
			this.dispatchTimeout = dispatchTimeout;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 设置执行处理器的调度器。处理器可能阻塞，默认使用 {@link Schedulers#boundedElastic()}。
		 */
		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "Scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		/**
		 * 构建服务器并启动接收循环。
		 * @throws IllegalArgumentException 如果方法名重复或服务声明无效
		 */
		public JsonRpcServer build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			List<JsonRpcServerFeatures.MethodSpecification> all = new ArrayList<>(this.methods);
			for (Object service : this.services) {
				all.addAll(ServiceBinder.bind(service, mapper.getTypeFactory()));
			}
			return new JsonRpcServer(this.transport, mapper, all, this.dispatchTimeout, this.scheduler);
		}

	}

}
