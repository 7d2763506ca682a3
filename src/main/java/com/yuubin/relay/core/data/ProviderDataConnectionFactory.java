package com.yuubin.relay.core.data;

import java.io.IOException;
import java.net.Socket;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.request.RequestType;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.spi.DataConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DataConnectionFactory}.
 * <p>
 * SOCKS5 and direct connections are built in. Other kinds are looked up among
 * the {@link DataConnectionProvider} implementations visible to
 * {@link ServiceLoader}; a kind with no connector fails. Every connection opened
 * here is tracked until it is released or {@link #closeAll()} runs.
 * </p>
 */
public class ProviderDataConnectionFactory implements DataConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderDataConnectionFactory.class);

    private final Map<RequestType, DataConnector> connectors = new EnumMap<>(RequestType.class);
    private final Set<DataConnection> open = ConcurrentHashMap.newKeySet();
    private volatile String dataAddress;

    /**
     * Creates a factory with the built-in connectors plus any SPI providers.
     * 
     * @param properties The relay configuration (data address, timeouts).
     */
    public ProviderDataConnectionFactory(RelayProperties properties) {
        this.dataAddress = properties.getDataAddress();
        FrameCodec codec = new FrameCodec(properties.getMaxFrameLength());
        connectors.put(RequestType.CREATE_SOCKS5_CONNECT,
                new Socks5DataConnector(properties.getTiming().dialTimeout()));
        connectors.put(RequestType.CREATE_DIRECT_CONNECT,
                new DirectDataConnector(codec, properties.getTiming().dialTimeout()));

        ServiceLoader<DataConnectionProvider> loader = ServiceLoader.load(DataConnectionProvider.class);
        for (DataConnectionProvider provider : loader) {
            register(provider.getKind(), provider.create(properties));
            log.info("Loaded data connection provider {} for {}", provider.getClass().getName(),
                    provider.getKind());
        }
    }

    /**
     * Registers or replaces the connector for a kind.
     * 
     * @param kind      A connection-creation kind.
     * @param connector The connector to use.
     */
    public final void register(RequestType kind, DataConnector connector) {
        if (!kind.isConnectionCreation()) {
            throw new IllegalArgumentException(kind + " is not a connection-creation kind");
        }
        connectors.put(kind, connector);
    }

    @Override
    public DataConnection create(RequestType kind, byte[] taskData) throws IOException {
        if (!kind.isConnectionCreation()) {
            throw new IllegalArgumentException(kind + " is not a connection-creation kind");
        }
        String address = dataAddress;
        if (AddressUtils.isBlank(address)) {
            throw new RelayException("No data address configured for " + kind);
        }
        DataConnector connector = connectors.get(kind);
        if (connector == null) {
            throw new RelayException("No data connection provider for " + kind);
        }

        Socket socket = connector.connect(address, taskData);
        DataConnection connection = new DataConnection(kind, socket);
        open.add(connection);
        log.debug("Opened {} data connection to {}", kind, socket.getRemoteSocketAddress());
        return connection;
    }

    public String getDataAddress() {
        return dataAddress;
    }

    /**
     * Changes the address used by subsequent {@link #create} calls.
     * 
     * @param dataAddress The new data address; blank disables data connections.
     */
    public void setDataAddress(String dataAddress) {
        this.dataAddress = dataAddress;
    }

    @Override
    public void release(DataConnection connection) {
        if (open.remove(connection)) {
            connection.close();
        }
    }

    @Override
    public void closeAll() {
        List<DataConnection> snapshot = new ArrayList<>(open);
        open.removeAll(snapshot);
        for (DataConnection connection : snapshot) {
            connection.close();
        }
        if (!snapshot.isEmpty()) {
            log.info("Closed {} data connection(s)", snapshot.size());
        }
    }

    public int openConnections() {
        return open.size();
    }
}
