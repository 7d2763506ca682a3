package com.yuubin.relay.core.data;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.request.RequestType;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.spi.DataConnectionProvider;

import java.net.Socket;

/**
 * Test provider registered through META-INF/services: dials the data address
 * and writes the task payload verbatim.
 */
public class LoopbackShadowsocksProvider implements DataConnectionProvider {

    @Override
    public RequestType getKind() {
        return RequestType.CREATE_SS_CONNECT;
    }

    @Override
    public DataConnector create(RelayProperties properties) {
        return (dataAddress, taskData) -> {
            Socket socket = new Socket();
            socket.connect(AddressUtils.parse(dataAddress), 1000);
            socket.getOutputStream().write(taskData);
            socket.getOutputStream().flush();
            return socket;
        };
    }
}
