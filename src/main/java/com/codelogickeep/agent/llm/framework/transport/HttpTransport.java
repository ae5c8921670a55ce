package com.codelogickeep.agent.llm.framework.transport;

import com.codelogickeep.agent.llm.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * HTTP 传输层 - 共享的 HttpClient 与单次请求超时
 *
 * 只负责发出一次 POST 并把传输异常映射为 {@link ProviderException}；
 * 不做重试，不解析状态码。
 */
public class HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(120);

    /**
     * java.net.http 不允许调用方设置的请求头（jdk.httpclient.allowRestrictedHeaders 未开启时）
     */
    static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    // RFC 7230 token
    private static final Pattern HEADER_NAME = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    /**
     * 使用默认连接超时创建传输层
     */
    public static HttpTransport create(Duration requestTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build();
        return new HttpTransport(client, requestTimeout);
    }

    /**
     * 检查自定义请求头能否被 HttpClient 接受
     *
     * @return 每个不合法请求头的问题描述，全部合法时为空列表
     */
    public static List<String> headerProblems(Map<String, String> headers) {
        List<String> problems = new ArrayList<>();
        if (headers == null) {
            return problems;
        }
        headers.forEach((name, value) -> {
            if (name == null || !HEADER_NAME.matcher(name).matches()) {
                problems.add("invalid header name '" + name + "'");
            } else if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                problems.add("header '" + name + "' is managed by the HTTP client and cannot be set");
            } else if (value == null) {
                problems.add("header '" + name + "' has no value");
            } else if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                problems.add("header '" + name + "' contains a line break");
            }
        });
        return problems;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * 发送 JSON POST 请求
     *
     * @param provider 提供商名称（用于错误信息）
     * @param endpoint 目标地址
     * @param headers  请求头（包含鉴权头）
     * @param body     序列化后的请求体
     * @return 原始响应，状态码由调用方处理
     * @throws ProviderException TIMEOUT 或 CONNECTION_FAILURE
     */
    public HttpResponse<String> post(String provider, URI endpoint, Map<String, String> headers, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        headers.forEach(builder::header);

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("{} request to {} timed out after {}", provider, endpoint, requestTimeout);
            throw ProviderException.timeout(provider, e);
        } catch (ConnectException e) {
            log.warn("{} endpoint {} unreachable: {}", provider, endpoint, e.getMessage());
            throw ProviderException.connectionFailure(provider, e);
        } catch (IOException e) {
            log.warn("{} transport error for {}: {}", provider, endpoint, e.getMessage());
            throw ProviderException.connectionFailure(provider, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.connectionFailure(provider, e);
        }
    }
}
