package com.umitunal.hybridq.client;

import com.umitunal.hybridq.config.ClientConfig;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.JobView;
import com.umitunal.hybridq.core.QueueState;
import com.umitunal.hybridq.protocol.AckResponse;
import com.umitunal.hybridq.protocol.ErrorResponse;
import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.protocol.JobResponse;
import com.umitunal.hybridq.protocol.KillRequest;
import com.umitunal.hybridq.protocol.MessageCodec;
import com.umitunal.hybridq.protocol.QueueStateRequest;
import com.umitunal.hybridq.protocol.QueueStateResponse;
import com.umitunal.hybridq.protocol.QueueStatusRequest;
import com.umitunal.hybridq.protocol.QueueStatusResponse;
import com.umitunal.hybridq.protocol.RemoveRequest;
import com.umitunal.hybridq.protocol.Request;
import com.umitunal.hybridq.protocol.Response;
import com.umitunal.hybridq.protocol.SetQueueStateRequest;
import com.umitunal.hybridq.protocol.SubmitRequest;
import com.umitunal.hybridq.protocol.SubmitResponse;
import com.umitunal.hybridq.transport.PlainTransport;
import com.umitunal.hybridq.transport.TlsTransport;
import com.umitunal.hybridq.transport.Transport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLException;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Client side of the daemon protocol. One instance holds one connection,
 * opened lazily on the first call and reused for the following ones.
 *
 * <pre>{@code
 * try (QueueClient client = QueueClient.create(config)) {
 *     long id = client.submit("sleep 5", 5L, null);
 *     List<JobView> jobs = client.queueStatus();
 * }
 * }</pre>
 */
public class QueueClient implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(QueueClient.class);

    private final ClientConfig config;
    private final Transport transport;
    private final FrameCodec frames;
    private final MessageCodec codec;

    private Socket socket;
    private InputStream in;
    private OutputStream out;

    QueueClient(ClientConfig config, Transport transport) {
        this.config = config;
        this.transport = transport;
        this.frames = new FrameCodec(config.getMaxFrameBytes());
        this.codec = new MessageCodec();
    }

    /**
     * @throws HybridQueueException CONFIG_CONFLICT for conflicting options, TLS_ERROR for unusable key material
     */
    public static QueueClient create(ClientConfig config) throws HybridQueueException {
        config.validate();
        Transport transport = config.isInsecure()
                ? new PlainTransport()
                : TlsTransport.create(config.toTlsSettings());
        return new QueueClient(config, transport);
    }

    /**
     * Submit a job.
     *
     * @param expectedDuration estimated runtime in seconds, informational only, may be null
     * @param notifyCmd command run by the daemon once the job finishes, may be null
     * @return the id the daemon assigned
     */
    public synchronized long submit(String cmdline, Long expectedDuration, String notifyCmd)
            throws HybridQueueException {
        Response response = call(new SubmitRequest(cmdline, expectedDuration, notifyCmd));
        return expect(response, SubmitResponse.class).getJobId();
    }

    /**
     * @return every job the daemon knows, in submission order
     */
    public synchronized List<JobView> queueStatus() throws HybridQueueException {
        Response response = call(new QueueStatusRequest());
        return expect(response, QueueStatusResponse.class).getJobs();
    }

    /**
     * Drop a finished job from the daemon's status list.
     *
     * @return the removed job
     */
    public synchronized JobView remove(long jobId) throws HybridQueueException {
        Response response = call(new RemoveRequest(jobId));
        return expect(response, JobResponse.class).getJob();
    }

    /**
     * Ask the daemon to terminate the running job.
     */
    public synchronized void kill(long jobId) throws HybridQueueException {
        expect(call(new KillRequest(jobId)), AckResponse.class);
    }

    public synchronized QueueState queueState() throws HybridQueueException {
        return expect(call(new QueueStateRequest()), QueueStateResponse.class).getState();
    }

    /**
     * Pause or resume the daemon's queue.
     *
     * @return the state the daemon reports afterwards; STOPPING while a job is still running
     */
    public synchronized QueueState setQueueState(QueueState state) throws HybridQueueException {
        return expect(call(new SetQueueStateRequest(state)), QueueStateResponse.class).getState();
    }

    private Response call(Request request) throws HybridQueueException {
        try {
            connectIfNeeded();
            byte[] encoded = codec.encodeRequest(request);
            if (config.isDumpProtocol()) {
                LOG.info("request: {}", new String(encoded, StandardCharsets.UTF_8));
            }
            frames.writeFrame(out, encoded);

            byte[] frame = frames.readFrame(in);
            if (frame == null) {
                throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR, "Daemon closed the connection");
            }
            if (config.isDumpProtocol()) {
                LOG.info("response: {}", new String(frame, StandardCharsets.UTF_8));
            }
            return codec.decodeResponse(frame);
        } catch (SSLException e) {
            disconnect();
            throw new HybridQueueException(ErrorKind.TLS_ERROR, "TLS failure: " + e.getMessage(), e);
        } catch (IOException e) {
            disconnect();
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR,
                    "Communication with " + config.getHost() + ":" + config.getPort() + " failed: " + e.getMessage(), e);
        } catch (HybridQueueException e) {
            disconnect();
            throw e;
        }
    }

    private static <T extends Response> T expect(Response response, Class<T> type) throws HybridQueueException {
        if (response instanceof ErrorResponse) {
            throw ((ErrorResponse) response).toException();
        }
        if (!type.isInstance(response)) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR,
                    "Expected " + type.getSimpleName() + " but got " + response);
        }
        return type.cast(response);
    }

    private void connectIfNeeded() throws IOException, HybridQueueException {
        if (socket != null) {
            return;
        }
        LOG.debug("Connecting to {}:{} ({})", config.getHost(), config.getPort(), transport);
        socket = transport.connect(config.getHost(), config.getPort(), config.getTimeoutMillis());
        in = new BufferedInputStream(socket.getInputStream());
        out = new BufferedOutputStream(socket.getOutputStream());
    }

    private void disconnect() {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Failed to close connection: {}", e.getMessage());
        }
        socket = null;
        in = null;
        out = null;
    }

    @Override
    public synchronized void close() {
        disconnect();
    }
}
