package org.iceforge.freeagent.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import org.iceforge.freeagent.client.auth.AccessTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Blocking JSON transport for the FreeAgent v2 API.
 * <p>
 * FreeAgent wraps every payload in a root element named after the resource ({@code {"contact": {...}}},
 * {@code {"contacts": [...]}}). Callers name the root and get typed values back; wrapping and unwrapping
 * happen here.
 */
public class FreeAgentHttp {
    private static final Logger logger = LoggerFactory.getLogger(FreeAgentHttp.class);

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public FreeAgentHttp(WebClient.Builder builder, FreeAgentProperties props, AccessTokenProvider tokens) {
        this(builder, props, tokens, FreeAgentJson.mapper());
    }

    public FreeAgentHttp(WebClient.Builder builder, FreeAgentProperties props, AccessTokenProvider tokens,
                         ObjectMapper mapper) {
        Objects.requireNonNull(tokens, "tokens");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = props.getRequestTimeout();
        this.webClient = builder
                .baseUrl(props.resolvedApiBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .filter((request, next) -> next.exchange(ClientRequest.from(request)
                        .headers(h -> h.setBearerAuth(tokens.accessToken()))
                        .build()))
                .build();
    }

    public <T> T getOne(String path, String root, Class<T> type) {
        String body = exchange(HttpMethod.GET, path, Map.of(), null);
        return readOne(HttpMethod.GET, path, body, root, type);
    }

    /** A missing root element is read as an empty list. */
    public <T> List<T> getList(String path, Map<String, String> params, String root, Class<T> type) {
        String body = exchange(HttpMethod.GET, path, params, null);
        return readList(HttpMethod.GET, path, body, root, type);
    }

    public <T> T post(String path, Map<String, String> params, String root, Object entity, Class<T> type) {
        String body = exchange(HttpMethod.POST, path, params, write(HttpMethod.POST, path, root, entity));
        return readOne(HttpMethod.POST, path, body, root, type);
    }

    /** Batch create: the request and response roots are both the plural name. */
    public <T> List<T> postList(String path, String root, List<?> entities, Class<T> type) {
        String body = exchange(HttpMethod.POST, path, Map.of(), write(HttpMethod.POST, path, root, entities));
        return readList(HttpMethod.POST, path, body, root, type);
    }

    public <T> T put(String path, String root, Object entity, Class<T> type) {
        String body = exchange(HttpMethod.PUT, path, Map.of(), write(HttpMethod.PUT, path, root, entity));
        return readOne(HttpMethod.PUT, path, body, root, type);
    }

    /** Body-less call that answers with the changed entity, e.g. a state transition or a timer. */
    public <T> T action(HttpMethod method, String path, String root, Class<T> type) {
        String body = exchange(method, path, Map.of(), null);
        return readOne(method, path, body, root, type);
    }

    public void delete(String path) {
        exchange(HttpMethod.DELETE, path, Map.of(), null);
    }

    // ----------------------------------------------------------------------
    // Internals
    // ----------------------------------------------------------------------

    private String exchange(HttpMethod method, String path, Map<String, String> params, String jsonBody) {
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(b -> buildUri(b, path, params));

        WebClient.RequestHeadersSpec<?> ready = jsonBody == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(jsonBody);

        try {
            String body = ready.retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new FreeAgentApiException(method, path, resp.statusCode().value(), text)))
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .blockOptional()
                    .orElse("");
            logger.debug("FreeAgent {} {} {} -> {} bytes", method, path, params, body.length());
            return body;
        } catch (FreeAgentApiException e) {
            logger.warn("FreeAgent {} {} returned HTTP {}", method, path, e.status());
            throw e;
        } catch (RuntimeException e) {
            logger.error("FreeAgent {} {} failed: {}", method, path, e.toString());
            throw new FreeAgentApiException(method, path, e.getMessage() == null ? e.toString() : e.getMessage(), e);
        }
    }

    // values go in as uri variables so '&', '=' and '+' inside them are encoded
    private static URI buildUri(UriBuilder b, String path, Map<String, String> params) {
        b.path(path);
        params.keySet().forEach(name -> b.queryParam(name, "{" + name + "}"));
        return b.build(params);
    }

    private String write(HttpMethod method, String path, String root, Object entity) {
        try {
            return mapper.writeValueAsString(Map.of(root, entity));
        } catch (JsonProcessingException e) {
            throw new FreeAgentApiException(method, path, "could not serialize request body", e);
        }
    }

    private <T> T readOne(HttpMethod method, String path, String body, String root, Class<T> type) {
        JsonNode node = unwrap(method, path, body, root);
        if (node == null) {
            throw new FreeAgentApiException(method, path, "response has no '" + root + "' element", null);
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new FreeAgentApiException(method, path, "could not read '" + root + "' as " + type.getSimpleName(), e);
        }
    }

    private <T> List<T> readList(HttpMethod method, String path, String body, String root, Class<T> type) {
        JsonNode node = unwrap(method, path, body, root);
        if (node == null) {
            return List.of();
        }
        CollectionType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            List<T> values = mapper.readerFor(listType).readValue(node);
            return Collections.unmodifiableList(values);
        } catch (IOException e) {
            throw new FreeAgentApiException(method, path, "could not read '" + root + "' as a list of " + type.getSimpleName(), e);
        }
    }

    private JsonNode unwrap(HttpMethod method, String path, String body, String root) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body).get(root);
            return node == null || node.isNull() ? null : node;
        } catch (JsonProcessingException e) {
            throw new FreeAgentApiException(method, path, "response is not JSON", e);
        }
    }
}
