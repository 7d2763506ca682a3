package com.yuubin.relay.spi;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.data.DataConnector;
import com.yuubin.relay.core.request.RequestType;

/**
 * Service Provider Interface (SPI) for data connection transports that are not
 * built in (for example shadowsocks).
 * Implementations are registered in
 * META-INF/services/com.yuubin.relay.spi.DataConnectionProvider.
 */
public interface DataConnectionProvider {
    /**
     * Retrieves the connection-creation kind this provider serves.
     * 
     * @return One of {@link RequestType#CONNECTION_KINDS}.
     */
    RequestType getKind();

    /**
     * Creates the connector for this kind.
     * 
     * @param properties The relay configuration.
     * @return A connector; invoked once per creation request.
     */
    DataConnector create(RelayProperties properties);
}
