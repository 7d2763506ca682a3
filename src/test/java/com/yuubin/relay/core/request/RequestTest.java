package com.yuubin.relay.core.request;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class RequestTest {

    @Test
    void nullPayload_isEmpty() {
        Request request = new Request(RequestType.PING, null);

        assertThat(request.taskData()).isEmpty();
        assertThat(request.hasTaskData()).isFalse();
        assertThat(request).isEqualTo(Request.of(RequestType.PING));
    }

    @Test
    void equality_comparesPayloadByContent() {
        Request a = new Request(RequestType.PUSH_TASK, new byte[] { 1, 2 });
        Request b = new Request(RequestType.PUSH_TASK, new byte[] { 1, 2 });

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new Request(RequestType.TASK_RESULT, new byte[] { 1, 2 }));
        assertThat(a).isNotEqualTo(new Request(RequestType.PUSH_TASK, new byte[] { 1 }));
    }

    @Test
    void payload_isCopiedOnTheWayInAndOut() {
        byte[] payload = { 1 };
        Request request = new Request(RequestType.PUSH_TASK, payload);
        payload[0] = 2;
        request.taskData()[0] = 3;

        assertThat(request.taskData()).containsExactly(1);
    }

    @Test
    void connectionKinds_areExactlyTheCreateKinds() {
        assertThat(RequestType.CONNECTION_KINDS).containsExactly(
                RequestType.CREATE_SS_CONNECT,
                RequestType.CREATE_SOCKS5_CONNECT,
                RequestType.CREATE_DIRECT_CONNECT);

        for (RequestType type : EnumSet.complementOf(EnumSet.copyOf(RequestType.CONNECTION_KINDS))) {
            assertThat(type.isConnectionCreation()).as(type.name()).isFalse();
        }
    }
}
