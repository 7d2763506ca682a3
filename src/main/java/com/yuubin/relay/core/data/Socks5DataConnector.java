package com.yuubin.relay.core.data;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.yuubin.relay.core.exceptions.ProtocolException;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * Opens a data connection through a SOCKS5 proxy at the data address.
 * The task payload names the target as {@code host:port} (UTF-8).
 * Only the 'No Authentication' method is offered.
 */
public class Socks5DataConnector implements DataConnector {

    private final Duration connectTimeout;

    public Socks5DataConnector(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Socket connect(String dataAddress, byte[] taskData) throws IOException {
        String target = new String(taskData, StandardCharsets.UTF_8).trim();
        InetSocketAddress parsed = AddressUtils.parseUnresolved(target);
        InetSocketAddress proxy = AddressUtils.parse(dataAddress);

        Socket socket = new Socket();
        try {
            socket.connect(proxy, (int) connectTimeout.toMillis());
            performHandshake(socket, parsed.getHostString(), parsed.getPort());
            return socket;
        } catch (IOException | RuntimeException e) {
            IoUtils.closeQuietly(socket);
            throw e;
        }
    }

    /**
     * Performs the SOCKS5 greeting and CONNECT exchange.
     * 
     * @param socket The socket connected to the proxy.
     * @param host   The target host.
     * @param port   The target port.
     * @throws IOException If the handshake fails or the proxy returns an error.
     */
    private static void performHandshake(Socket socket, String host, int port) throws IOException {
        DataOutputStream out = new DataOutputStream(socket.getOutputStream());

        // Greeting: SOCKS5, 1 method, No Auth
        out.writeByte(5);
        out.writeByte(1);
        out.writeByte(0);
        out.flush();

        DataInputStream in = new DataInputStream(socket.getInputStream());
        if (in.readByte() != 5 || in.readByte() != 0) {
            throw new IOException("SOCKS5 data proxy requires authentication (not supported)");
        }

        byte[] hostBytes = host.getBytes(StandardCharsets.UTF_8);
        if (hostBytes.length > 255) {
            throw new ProtocolException("SOCKS5 target host too long: " + hostBytes.length + " bytes");
        }

        // Request: CONNECT, domain name
        out.writeByte(5);
        out.writeByte(1);
        out.writeByte(0);
        out.writeByte(3);
        out.writeByte(hostBytes.length);
        out.write(hostBytes);
        out.writeShort(port);
        out.flush();

        if (in.readByte() != 5) {
            throw new IOException("SOCKS5 data proxy sent an invalid reply");
        }
        int status = in.readUnsignedByte();
        if (status != 0) {
            throw new IOException("SOCKS5 data proxy failed to connect to " + host + ":" + port
                    + " (reply " + status + ")");
        }
        in.readByte(); // RSV
        byte atyp = in.readByte();
        switch (atyp) {
            case 1 -> in.readFully(new byte[4]);
            case 3 -> in.readFully(new byte[in.readUnsignedByte()]);
            case 4 -> in.readFully(new byte[16]);
            default -> throw new IOException("SOCKS5 data proxy sent unknown address type " + atyp);
        }
        in.readUnsignedShort(); // BND.PORT
    }
}
