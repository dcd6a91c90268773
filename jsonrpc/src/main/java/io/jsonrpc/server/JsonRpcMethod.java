/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 将服务对象上的公共实例方法导出为JSON-RPC方法。
 *
 * @see ServiceBinder
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface JsonRpcMethod {

	/**
	 * 线上方法名。为空时使用Java方法名。
	 */
	String value() default "";

}
