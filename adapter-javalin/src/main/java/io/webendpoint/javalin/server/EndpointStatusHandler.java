package io.webendpoint.javalin.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Default dispatch target: answers every request with {@code 200 OK} and
 * {@code {"endpoint":"<id>","status":"UP"}}. Applications plug their own handler in through the
 * dispatch resolver of {@link JavalinServerAdapter}.
 */
public final class EndpointStatusHandler implements Handler {

    private final String body;

    public EndpointStatusHandler(String endpointId) {
        this.body = "{\"endpoint\":\"" + endpointId.replace("\\", "\\\\").replace("\"", "\\\"") + "\",\"status\":\"UP\"}";
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
