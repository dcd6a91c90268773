/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 方法名到 {@link CallSite} 的注册表。
 *
 * <p>
 * 方法以 {@link JsonRpcServerFeatures.MethodSpecification} 注册；对应的调用点在某个名称第一次被分发时
 * 惰性创建并在注册表的生命周期内缓存。查找不加锁；创建在锁内以双重检查完成，因此即使多个分发任务
 * 同时首次使用同一个名称，每个名称也只会创建一个调用点。
 */
public class CallSiteRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CallSiteRegistry.class);

	private final ObjectMapper objectMapper;

	private final ConcurrentHashMap<String, JsonRpcServerFeatures.MethodSpecification> specifications = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, CallSite> callSites = new ConcurrentHashMap<>();

	private final Lock creationLock = new ReentrantLock();

	private final AtomicInteger created = new AtomicInteger();

	public CallSiteRegistry(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * 注册一个方法。
	 * @param specification 方法规范
	 * @throws IllegalArgumentException 如果同名方法已经注册
	 */
	public void register(JsonRpcServerFeatures.MethodSpecification specification) {
		Assert.notNull(specification, "Method specification must not be null");
		if (this.specifications.putIfAbsent(specification.name(), specification) != null) {
			throw new IllegalArgumentException("Method with name '" + specification.name() + "' already exists");
		}
		logger.debug("Registered method: {}", specification.name());
	}

	/**
	 * 解析方法名。
	 * @param name 线上方法名
	 * @return 调用点；如果没有注册该名称则返回null
	 */
	public CallSite lookup(String name) {
		CallSite callSite = this.callSites.get(name);
		if (callSite != null) {
			return callSite;
		}

		JsonRpcServerFeatures.MethodSpecification specification = this.specifications.get(name);
		if (specification == null) {
			return null;
		}

		this.creationLock.lock();
		try {
			callSite = this.callSites.get(name);
			if (callSite == null) {
				callSite = new CallSite(specification, this.objectMapper);
				this.callSites.put(name, callSite);
				this.created.incrementAndGet();
				logger.debug("Created call site {}", callSite);
			}
			return callSite;
		}
		finally {
			this.creationLock.unlock();
		}
	}

	public boolean contains(String name) {
		return this.specifications.containsKey(name);
	}

	public Set<String> methodNames() {
		return Set.copyOf(this.specifications.keySet());
	}

	/**
	 * 迄今创建的调用点数量。
	 */
	int callSitesCreated() {
		return this.created.get();
	}

}
