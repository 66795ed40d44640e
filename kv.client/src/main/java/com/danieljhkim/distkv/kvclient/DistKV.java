package com.danieljhkim.distkv.kvclient;

import com.danieljhkim.distkv.kvcommon.api.AccumulateTSRequest;
import com.danieljhkim.distkv.kvcommon.api.AccumulateTSResponse;
import com.danieljhkim.distkv.kvcommon.api.ContainsRequest;
import com.danieljhkim.distkv.kvcommon.api.ContainsResponse;
import com.danieljhkim.distkv.kvcommon.api.DeleteRangeRequest;
import com.danieljhkim.distkv.kvcommon.api.DeleteRangeResponse;
import com.danieljhkim.distkv.kvcommon.api.DeleteRequest;
import com.danieljhkim.distkv.kvcommon.api.DeleteResponse;
import com.danieljhkim.distkv.kvcommon.api.EndTransactionRequest;
import com.danieljhkim.distkv.kvcommon.api.EndTransactionResponse;
import com.danieljhkim.distkv.kvcommon.api.EnqueueMessageRequest;
import com.danieljhkim.distkv.kvcommon.api.EnqueueMessageResponse;
import com.danieljhkim.distkv.kvcommon.api.EnqueueUpdateRequest;
import com.danieljhkim.distkv.kvcommon.api.EnqueueUpdateResponse;
import com.danieljhkim.distkv.kvcommon.api.GetRequest;
import com.danieljhkim.distkv.kvcommon.api.GetResponse;
import com.danieljhkim.distkv.kvcommon.api.IncrementRequest;
import com.danieljhkim.distkv.kvcommon.api.IncrementResponse;
import com.danieljhkim.distkv.kvcommon.api.PutRequest;
import com.danieljhkim.distkv.kvcommon.api.PutResponse;
import com.danieljhkim.distkv.kvcommon.api.ReapQueueRequest;
import com.danieljhkim.distkv.kvcommon.api.ReapQueueResponse;
import com.danieljhkim.distkv.kvcommon.api.ScanRequest;
import com.danieljhkim.distkv.kvcommon.api.ScanResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the distributed key value store.
 *
 * <p>
 * Every method returns immediately. The returned future receives exactly one
 * response, which either carries the result or has its error slot set; it is
 * not completed exceptionally.
 */
public interface DistKV {

	/** Checks for the existence of a key. */
	CompletableFuture<ContainsResponse> contains(ContainsRequest args);

	CompletableFuture<GetResponse> get(GetRequest args);

	CompletableFuture<PutResponse> put(PutRequest args);

	CompletableFuture<IncrementResponse> increment(IncrementRequest args);

	CompletableFuture<DeleteResponse> delete(DeleteRequest args);

	/** Routed by the start key only. */
	CompletableFuture<DeleteRangeResponse> deleteRange(DeleteRangeRequest args);

	/** Not supported yet: completes with an UNIMPLEMENTED error. */
	CompletableFuture<ScanResponse> scan(ScanRequest args);

	/** Routed by the first transaction key only. */
	CompletableFuture<EndTransactionResponse> endTransaction(EndTransactionRequest args);

	/**
	 * Accumulates a time series of int64 counts representing discrete sub-times.
	 */
	CompletableFuture<AccumulateTSResponse> accumulateTS(AccumulateTSRequest args);

	/**
	 * Scans and deletes messages from a recipient inbox. Must be part of an
	 * existing transaction.
	 */
	CompletableFuture<ReapQueueResponse> reapQueue(ReapQueueRequest args);

	/** Not supported yet: completes with an UNIMPLEMENTED error. */
	CompletableFuture<EnqueueUpdateResponse> enqueueUpdate(EnqueueUpdateRequest args);

	/** Enqueues a message for delivery to an inbox. */
	CompletableFuture<EnqueueMessageResponse> enqueueMessage(EnqueueMessageRequest args);
}
