package prflow.coordinator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.util.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            return new ControllerResponse(status, "application/json", Json.write(value));
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, "application/json", "");
        }

        public static ControllerResponse notFound(String message) {
            return errorBody(HttpResponseStatus.NOT_FOUND, message, null);
        }

        public static ControllerResponse badRequest(String message) {
            return errorBody(HttpResponseStatus.BAD_REQUEST, message, null);
        }

        public static ControllerResponse error(String message) {
            return errorBody(HttpResponseStatus.INTERNAL_SERVER_ERROR, message, null);
        }

        /**
         * Map a queue rejection to its HTTP status.
         */
        public static ControllerResponse rejected(QueueException e) {
            HttpResponseStatus status = switch (e.code()) {
                case INVALID_PARAMETER -> HttpResponseStatus.BAD_REQUEST;
                case UNKNOWN_REQUEST -> HttpResponseStatus.NOT_FOUND;
                case DUPLICATE_ACTIVE_REQUEST, INVALID_TRANSITION -> HttpResponseStatus.CONFLICT;
            };
            return errorBody(status, e.getMessage(), e.code().name());
        }

        private static ControllerResponse errorBody(HttpResponseStatus status, String message, String code) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", message != null ? message : status.reasonPhrase());
            if (code != null) {
                body.put("code", code);
            }
            return json(status, body);
        }
    }
}
