package com.acme.wizard.remote.http;

import com.acme.wizard.context.ContextView;
import com.acme.wizard.core.Jsons;
import com.acme.wizard.core.PermanentException;
import com.acme.wizard.remote.FailureCategory;
import com.acme.wizard.remote.RemoteResult;
import com.acme.wizard.remote.RemoteStepService;
import com.acme.wizard.step.FieldError;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote step backed by a JSON POST to {@code baseUrl + path}. The request carries a bearer token
 * and an idempotency key derived from the wizard id and the operation, so a repeated call for the
 * same wizard is recognised by the server.
 *
 * <p>Status codes map onto {@link FailureCategory}. I/O failures are not caught here: they
 * propagate to the error classifier, which reports timeouts as TIMEOUT and everything else as
 * NETWORK_ERROR.
 */
public class HttpRemoteStepService implements RemoteStepService {
    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteStepService.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final HttpRemoteConfig config;
    private final String operation;
    private final String path;
    private final Function<ContextView, Map<String, Object>> payloadBuilder;
    private final Supplier<String> tokenSupplier;
    private final List<String> identifierFields;

    private HttpRemoteStepService(Builder builder) {
        this.client = builder.client != null ? builder.client : newClient(builder.config);
        this.config = builder.config;
        this.operation = builder.operation;
        this.path = builder.path != null ? builder.path : "/api/" + builder.operation;
        this.payloadBuilder = builder.payloadBuilder;
        this.tokenSupplier = builder.tokenSupplier;
        this.identifierFields = List.copyOf(builder.identifierFields);
    }

    public static Builder builder(HttpRemoteConfig config, String operation) {
        return new Builder(config, operation);
    }

    public static OkHttpClient newClient(HttpRemoteConfig config) {
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    @Override
    public RemoteResult execute(ContextView context) throws IOException {
        String idempotencyKey = idempotencyKey(context);
        String payloadJson = Jsons.toJson(payloadBuilder.apply(context));

        Request.Builder request = new Request.Builder()
                .url(config.getBaseUrl() + path)
                .post(RequestBody.create(payloadJson, JSON))
                .addHeader(config.getIdempotencyHeader(), idempotencyKey);
        String token = tokenSupplier != null ? tokenSupplier.get() : null;
        if (token != null && !token.isBlank()) {
            request.addHeader("Authorization", "Bearer " + token);
        }

        logger.info("Executing {} for wizard {} with idempotency key {}", operation, context.wizardId(), idempotencyKey);

        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String responseBody = body != null ? body.string() : "";
            RemoteResult result = toResult(response.code(), responseBody);
            logger.debug("{} for wizard {} answered {}: {}", operation, context.wizardId(), response.code(), result);
            return result;
        }
    }

    String idempotencyKey(ContextView context) {
        return context.wizardId() + ":" + operation;
    }

    RemoteResult toResult(int status, String responseBody) {
        if (status >= 200 && status < 300) {
            return success(responseBody);
        }
        Map<String, Object> error = parse(responseBody);
        String message = message(error, responseBody);
        return switch (status) {
            case 400, 422 -> RemoteResult.validationFailure(message, fieldErrors(error.get("errors")));
            case 401 -> RemoteResult.failure(FailureCategory.UNAUTHORIZED, message);
            case 403 -> RemoteResult.failure(FailureCategory.FORBIDDEN, message);
            case 404 -> RemoteResult.failure(FailureCategory.NOT_FOUND, message);
            case 409 -> RemoteResult.failure(FailureCategory.CONFLICT, message);
            case 408, 504 -> RemoteResult.failure(FailureCategory.TIMEOUT, message);
            default -> RemoteResult.failure(FailureCategory.SERVER_ERROR, message);
        };
    }

    private RemoteResult success(String responseBody) {
        Map<String, Object> body = parse(responseBody);
        Map<String, Object> identifiers = new LinkedHashMap<>();
        if (identifierFields.isEmpty()) {
            body.forEach((field, value) -> {
                if (value != null) {
                    identifiers.put(field, value);
                }
            });
            return RemoteResult.success(identifiers);
        }
        List<String> missing = new ArrayList<>();
        for (String field : identifierFields) {
            Object value = body.get(field);
            if (value == null) {
                missing.add(field);
            } else {
                identifiers.put(field, value);
            }
        }
        if (!missing.isEmpty()) {
            logger.error("{} response lacks identifier fields {}: {}", operation, missing, responseBody);
            return RemoteResult.failure(
                    FailureCategory.SERVER_ERROR,
                    "The server response did not contain " + String.join(", ", missing));
        }
        return RemoteResult.success(identifiers);
    }

    private Map<String, Object> parse(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.toMap(responseBody);
        } catch (PermanentException e) {
            logger.debug("{} response is not a JSON object, using it as plain text", operation);
            return Map.of();
        }
    }

    private static String message(Map<String, Object> error, String responseBody) {
        for (String key : List.of("message", "detail", "title", "error")) {
            Object value = error.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        if (error.isEmpty() && responseBody != null && !responseBody.isBlank()) {
            return responseBody.trim();
        }
        return null;
    }

    /** Accepts {@code {"field": ["msg", ...]}}, {@code {"field": "msg"}} or a list of {field, message}. */
    @SuppressWarnings("unchecked")
    private static List<FieldError> fieldErrors(Object errors) {
        List<FieldError> result = new ArrayList<>();
        if (errors instanceof Map<?, ?> byField) {
            byField.forEach((field, messages) -> {
                if (messages instanceof List<?> list) {
                    list.forEach(m -> result.add(FieldError.of(String.valueOf(field), String.valueOf(m))));
                } else if (messages != null) {
                    result.add(FieldError.of(String.valueOf(field), String.valueOf(messages)));
                }
            });
        } else if (errors instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> entry) {
                    Map<String, Object> fields = (Map<String, Object>) entry;
                    Object field = fields.get("field");
                    result.add(FieldError.of(
                            field != null ? field.toString() : null,
                            String.valueOf(fields.getOrDefault("message", ""))));
                } else if (item != null) {
                    result.add(FieldError.of(null, item.toString()));
                }
            }
        }
        return result;
    }

    public String getOperation() {
        return operation;
    }

    public static class Builder {
        private final HttpRemoteConfig config;
        private final String operation;
        private OkHttpClient client;
        private String path;
        private Function<ContextView, Map<String, Object>> payloadBuilder = context -> Map.of();
        private Supplier<String> tokenSupplier;
        private final List<String> identifierFields = new ArrayList<>();

        private Builder(HttpRemoteConfig config, String operation) {
            this.config = Objects.requireNonNull(config, "config");
            if (operation == null || operation.isBlank()) {
                throw new IllegalArgumentException("operation must not be blank");
            }
            this.operation = operation;
        }

        public Builder client(OkHttpClient client) {
            this.client = client;
            return this;
        }

        /** Request path below the base URL; defaults to {@code /api/<operation>}. */
        public Builder path(String path) {
            this.path = path.startsWith("/") ? path : "/" + path;
            return this;
        }

        public Builder payload(Function<ContextView, Map<String, Object>> payloadBuilder) {
            this.payloadBuilder = Objects.requireNonNull(payloadBuilder, "payloadBuilder");
            return this;
        }

        /** Payload made of the listed context keys that are present. */
        public Builder payloadFromContext(String... keys) {
            return payload(context -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                for (String key : keys) {
                    if (context.contains(key)) {
                        payload.put(key, context.get(key));
                    }
                }
                return payload;
            });
        }

        public Builder bearerToken(Supplier<String> tokenSupplier) {
            this.tokenSupplier = tokenSupplier;
            return this;
        }

        /** Response fields returned as identifiers; without any, the whole response object is. */
        public Builder identifiers(String... fields) {
            identifierFields.addAll(List.of(fields));
            return this;
        }

        public HttpRemoteStepService build() {
            return new HttpRemoteStepService(this);
        }
    }
}
