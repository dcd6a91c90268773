/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import io.jsonrpc.spec.JsonRpcClientTransport;
import io.jsonrpc.util.LineDelimitedConnection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 基于持久连接的客户端传输。帧以换行分隔；多个并发调用共享同一个连接，仅通过RPC {@code id} 区分响应。
 *
 * <pre>{@code
 * var transport = StreamClientTransport.of(new Socket("localhost", 8080));
 * var client = JsonRpcClient.sync(transport).build();
 * }</pre>
 */
public class StreamClientTransport implements JsonRpcClientTransport {

	private final LineDelimitedConnection connection;

	public StreamClientTransport(InputStream input, OutputStream output) {
		this(new LineDelimitedConnection("jsonrpc-client", input, output));
	}

	StreamClientTransport(LineDelimitedConnection connection) {
		this.connection = connection;
	}

	/**
	 * 在已连接的套接字上创建传输。关闭传输会关闭套接字。
	 * @param socket 已连接的套接字
	 * @return 新的传输
	 * @throws IOException 如果无法获取套接字的流
	 */
	public static StreamClientTransport of(Socket socket) throws IOException {
		return new StreamClientTransport(new LineDelimitedConnection("jsonrpc-client-" + socket.getPort(),
				socket.getInputStream(), socket.getOutputStream()));
	}

	@Override
	public Mono<Void> sendFrame(byte[] frame) {
		return this.connection.write(frame);
	}

	@Override
	public Flux<byte[]> receiveFrames() {
		return this.connection.inbound();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return this.connection.closeGracefully();
	}

	@Override
	public void close() {
		this.connection.close();
	}

}
