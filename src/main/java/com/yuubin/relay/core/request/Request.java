package com.yuubin.relay.core.request;

import java.util.Arrays;
import java.util.Objects;

import com.yuubin.relay.core.utils.IoUtils;

/**
 * Channel-agnostic message passed from the poll loops to the dispatch loop.
 * Equality compares the task payload by content.
 *
 * @param type     The request kind.
 * @param taskData Opaque task payload; empty when the kind carries none.
 */
public record Request(RequestType type, byte[] taskData) {

    public Request {
        Objects.requireNonNull(type, "type");
        taskData = taskData == null ? IoUtils.EMPTY_BYTES : taskData.clone();
    }

    /**
     * Creates a request without a payload.
     * 
     * @param type The request kind.
     * @return A new request.
     */
    public static Request of(RequestType type) {
        return new Request(type, IoUtils.EMPTY_BYTES);
    }

    @Override
    public byte[] taskData() {
        return taskData.clone();
    }

    public boolean hasTaskData() {
        return taskData.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Request other)) {
            return false;
        }
        return type == other.type && Arrays.equals(taskData, other.taskData);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(taskData);
    }

    @Override
    public String toString() {
        return "Request[type=" + type + ", taskData=" + taskData.length + " bytes]";
    }
}
