package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.JobQueue;
import com.umitunal.hybridq.protocol.AckResponse;
import com.umitunal.hybridq.protocol.ErrorResponse;
import com.umitunal.hybridq.protocol.JobResponse;
import com.umitunal.hybridq.protocol.KillRequest;
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
import com.umitunal.hybridq.worker.JobExecutor;

/**
 * Answers decoded requests. Queue errors become error responses; nothing here touches the network.
 */
public class RequestDispatcher {
    private final JobQueue queue;
    private final JobExecutor executor;
    private final boolean allowNotify;

    public RequestDispatcher(JobQueue queue, JobExecutor executor, boolean allowNotify) {
        this.queue = queue;
        this.executor = executor;
        this.allowNotify = allowNotify;
    }

    public Response dispatch(Request request) {
        try {
            if (request instanceof SubmitRequest) {
                return submit((SubmitRequest) request);
            }
            if (request instanceof QueueStatusRequest) {
                return new QueueStatusResponse(queue.snapshot());
            }
            if (request instanceof RemoveRequest) {
                return new JobResponse(queue.remove(((RemoveRequest) request).getJobId()));
            }
            if (request instanceof KillRequest) {
                executor.terminate(((KillRequest) request).getJobId());
                return new AckResponse();
            }
            if (request instanceof QueueStateRequest) {
                return new QueueStateResponse(queue.getQueueState());
            }
            if (request instanceof SetQueueStateRequest) {
                return new QueueStateResponse(queue.setQueueState(((SetQueueStateRequest) request).getState()));
            }
            throw new HybridQueueException(ErrorKind.INVALID_REQUEST, "Unsupported request: " + request);
        } catch (HybridQueueException e) {
            return ErrorResponse.of(e);
        }
    }

    private Response submit(SubmitRequest request) throws HybridQueueException {
        String notifyCmd = request.getNotifyCmd();
        if (notifyCmd != null && !notifyCmd.isBlank() && !allowNotify) {
            throw new HybridQueueException(ErrorKind.INVALID_REQUEST, "Notify commands are disabled on this daemon");
        }
        long id = queue.submit(request.getCmdline(), request.getExpectedDuration(), notifyCmd);
        return new SubmitResponse(id);
    }
}
