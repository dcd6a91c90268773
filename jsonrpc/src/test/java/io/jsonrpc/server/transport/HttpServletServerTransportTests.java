/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.TestService;
import io.jsonrpc.TomcatTestUtil;
import io.jsonrpc.server.JsonRpcServer;
import org.apache.catalina.startup.Tomcat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link HttpServletServerTransport} 的HTTP层面测试。
 */
@Timeout(15)
class HttpServletServerTransportTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient httpClient = HttpClient.newBuilder()
		.version(HttpClient.Version.HTTP_1_1)
		.connectTimeout(Duration.ofSeconds(5))
		.build();

	private HttpServletServerTransport transport;

	private JsonRpcServer server;

	private Tomcat tomcat;

	@BeforeEach
	void setUp() throws Exception {
		this.transport = HttpServletServerTransport.builder().build();
		this.server = JsonRpcServer.builder(this.transport).service(new TestService()).build();
		this.tomcat = TomcatTestUtil.startTomcat(this.transport);
	}

	@AfterEach
	void tearDown() throws Exception {
		this.server.close();
		TomcatTestUtil.stop(this.tomcat);
	}

	private HttpResponse<String> post(String path, String body) throws Exception {
		HttpRequest request = HttpRequest
			.newBuilder(URI.create("http://localhost:" + TomcatTestUtil.port(this.tomcat) + path))
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return this.httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	@Test
	void requestIsAnsweredWithJson() throws Exception {
		HttpResponse<String> response = post("/rpc",
				"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"SayHello\",\"params\":[\"Alice\"]}");

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
				contentType -> assertThat(contentType).startsWith(HttpServletServerTransport.APPLICATION_JSON));
		JsonNode body = this.objectMapper.readTree(response.body());
		assertThat(body.get("id").asInt()).isEqualTo(1);
		assertThat(body.get("result").asText()).isEqualTo("Alice");
	}

	@Test
	void notificationIsAnsweredWithNoContent() throws Exception {
		HttpResponse<String> response = post("/rpc",
				"{\"jsonrpc\":\"2.0\",\"method\":\"Record\",\"params\":[\"x\"]}");

		assertThat(response.statusCode()).isEqualTo(204);
		assertThat(response.body()).isEmpty();
	}

	@Test
	void malformedFrameIsAnsweredWithNoContent() throws Exception {
		assertThat(post("/rpc", "{not json").statusCode()).isEqualTo(204);
	}

	@Test
	void unknownPathIsNotFound() throws Exception {
		assertThat(post("/other", "{}").statusCode()).isEqualTo(404);
	}

	@Test
	void closedTransportIsUnavailable() throws Exception {
		this.transport.closeGracefully().block(Duration.ofSeconds(5));

		assertThat(post("/rpc", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"SayHello\",\"params\":[\"A\"]}")
			.statusCode()).isEqualTo(503);
	}

}
