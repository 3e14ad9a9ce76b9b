/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.walkv.demo;

/**
 * Reply to one command, rendered as a single line.
 *
 * @param status  outcome code
 * @param message optional detail; empty when there is nothing to add
 * @param close   whether the session should end after this reply
 */
public record Response(Status status, String message, boolean close) {

    /** Response codes seen by clients. */
    public enum Status {
        /** The command succeeded. */
        OK,
        /** The command succeeded and returns data. */
        RESULT,
        /** The key does not exist. */
        NOT_FOUND,
        /** The command was malformed or the store failed; nothing was acknowledged. */
        ERROR
    }

    public Response {
        message = message == null ? "" : message;
    }

    public static Response ok(String message) {
        return new Response(Status.OK, message, false);
    }

    public static Response result(String message) {
        return new Response(Status.RESULT, message, false);
    }

    public static Response notFound(String message) {
        return new Response(Status.NOT_FOUND, message, false);
    }

    public static Response error(String message) {
        return new Response(Status.ERROR, message, false);
    }

    public static Response bye() {
        return new Response(Status.OK, "Goodbye", true);
    }

    /** e.g. {@code RESULT 42} or {@code OK} */
    public String render() {
        return message.isEmpty() ? status.name() : status.name() + " " + message;
    }
}
