package com.phillippitts.voicebridge.service.gateway.wyoming;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Client side of a Wyoming protocol TCP connection.
 *
 * <p>Each event is a single JSON header line ({@code type}, optional inline {@code data},
 * {@code data_length}, {@code payload_length}) followed by {@code data_length} bytes of JSON
 * data and {@code payload_length} bytes of payload. Data sent after the header is merged over
 * inline data.
 *
 * <p>Not thread-safe; one connection serves one request.
 */
public final class WyomingConnection implements Closeable {

    static final String PROTOCOL_VERSION = "1.5.2";

    /** Upper bound on header and data sections; payloads are bounded separately. */
    private static final int MAX_JSON_BYTES = 1024 * 1024;
    private static final int MAX_PAYLOAD_BYTES = 64 * 1024 * 1024;

    private final Socket socket;
    private final DataInputStream in;
    private final OutputStream out;

    private WyomingConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    /**
     * Opens a connection.
     *
     * @param host service host
     * @param port service port
     * @param connectTimeoutMs connect timeout
     * @param readTimeoutMs maximum wait for each read; exceeded waits raise
     *                      {@link java.net.SocketTimeoutException}
     */
    public static WyomingConnection open(String host, int port, int connectTimeoutMs, int readTimeoutMs)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            socket.setSoTimeout(readTimeoutMs);
            socket.setTcpNoDelay(true);
            return new WyomingConnection(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /**
     * Wraps an already connected socket, such as one accepted by a server.
     */
    public static WyomingConnection over(Socket socket) throws IOException {
        return new WyomingConnection(socket);
    }

    /**
     * Writes one event and flushes it.
     */
    public void write(WyomingEvent event) throws IOException {
        byte[] data = event.data().isEmpty()
                ? new byte[0]
                : event.data().toString().getBytes(StandardCharsets.UTF_8);

        JSONObject header = new JSONObject()
                .put("type", event.type())
                .put("version", PROTOCOL_VERSION);
        if (data.length > 0) {
            header.put("data_length", data.length);
        }
        if (event.hasPayload()) {
            header.put("payload_length", event.payload().length);
        }

        out.write(header.toString().getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.write(data);
        out.write(event.payload());
        out.flush();
    }

    /**
     * Reads the next event.
     *
     * @return the event, or {@code null} when the peer closed the connection between events
     * @throws IOException on socket errors, read timeouts, truncated events or malformed JSON
     */
    public WyomingEvent read() throws IOException {
        String headerLine = readLine();
        if (headerLine == null) {
            return null;
        }
        try {
            JSONObject header = new JSONObject(headerLine);
            String type = header.getString("type");
            JSONObject data = header.optJSONObject("data");
            if (data == null) {
                data = new JSONObject();
            }

            int dataLength = boundedLength(header.optInt("data_length", 0), MAX_JSON_BYTES, "data_length");
            if (dataLength > 0) {
                byte[] extra = new byte[dataLength];
                in.readFully(extra);
                JSONObject extraData = new JSONObject(new String(extra, StandardCharsets.UTF_8));
                for (String key : extraData.keySet()) {
                    data.put(key, extraData.get(key));
                }
            }

            int payloadLength = boundedLength(header.optInt("payload_length", 0), MAX_PAYLOAD_BYTES,
                    "payload_length");
            byte[] payload = null;
            if (payloadLength > 0) {
                payload = new byte[payloadLength];
                in.readFully(payload);
            }
            return new WyomingEvent(type, data, payload);
        } catch (JSONException e) {
            throw new IOException("Malformed Wyoming event: " + e.getMessage(), e);
        }
    }

    private static int boundedLength(int length, int max, String field) throws IOException {
        if (length < 0 || length > max) {
            throw new IOException("Invalid " + field + ": " + length);
        }
        return length;
    }

    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (line.size() == 0) {
                    return null;
                }
                throw new EOFException("Connection closed in the middle of an event header");
            }
            if (b == '\n') {
                return line.toString(StandardCharsets.UTF_8);
            }
            if (line.size() >= MAX_JSON_BYTES) {
                throw new IOException("Wyoming header line exceeds " + MAX_JSON_BYTES + " bytes");
            }
            line.write(b);
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
