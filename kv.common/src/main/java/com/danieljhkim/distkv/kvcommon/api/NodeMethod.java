package com.danieljhkim.distkv.kvcommon.api;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A storage node RPC method, typed by its request and response.
 *
 * <p>
 * The constants below are the complete method table of the {@code Node}
 * service. Transports use {@link #getFullName()} as the wire method name and
 * {@link #newResponse()} to build a response when a call fails terminally.
 *
 * @param <Q>
 *            request type
 * @param <R>
 *            response type
 */
public final class NodeMethod<Q extends KvRequest<Q>, R extends KvResponse> {

	public static final String SERVICE_NAME = "Node";

	public static final NodeMethod<ContainsRequest, ContainsResponse> CONTAINS =
			new NodeMethod<>("Contains", ContainsRequest.class, ContainsResponse.class, ContainsResponse::new);
	public static final NodeMethod<GetRequest, GetResponse> GET =
			new NodeMethod<>("Get", GetRequest.class, GetResponse.class, GetResponse::new);
	public static final NodeMethod<PutRequest, PutResponse> PUT =
			new NodeMethod<>("Put", PutRequest.class, PutResponse.class, PutResponse::new);
	public static final NodeMethod<IncrementRequest, IncrementResponse> INCREMENT =
			new NodeMethod<>("Increment", IncrementRequest.class, IncrementResponse.class, IncrementResponse::new);
	public static final NodeMethod<DeleteRequest, DeleteResponse> DELETE =
			new NodeMethod<>("Delete", DeleteRequest.class, DeleteResponse.class, DeleteResponse::new);
	public static final NodeMethod<DeleteRangeRequest, DeleteRangeResponse> DELETE_RANGE =
			new NodeMethod<>("DeleteRange", DeleteRangeRequest.class, DeleteRangeResponse.class,
					DeleteRangeResponse::new);
	public static final NodeMethod<ScanRequest, ScanResponse> SCAN =
			new NodeMethod<>("Scan", ScanRequest.class, ScanResponse.class, ScanResponse::new);
	public static final NodeMethod<EndTransactionRequest, EndTransactionResponse> END_TRANSACTION =
			new NodeMethod<>("EndTransaction", EndTransactionRequest.class, EndTransactionResponse.class,
					EndTransactionResponse::new);
	public static final NodeMethod<AccumulateTSRequest, AccumulateTSResponse> ACCUMULATE_TS =
			new NodeMethod<>("AccumulateTS", AccumulateTSRequest.class, AccumulateTSResponse.class,
					AccumulateTSResponse::new);
	public static final NodeMethod<ReapQueueRequest, ReapQueueResponse> REAP_QUEUE =
			new NodeMethod<>("ReapQueue", ReapQueueRequest.class, ReapQueueResponse.class, ReapQueueResponse::new);
	public static final NodeMethod<EnqueueUpdateRequest, EnqueueUpdateResponse> ENQUEUE_UPDATE =
			new NodeMethod<>("EnqueueUpdate", EnqueueUpdateRequest.class, EnqueueUpdateResponse.class,
					EnqueueUpdateResponse::new);
	public static final NodeMethod<EnqueueMessageRequest, EnqueueMessageResponse> ENQUEUE_MESSAGE =
			new NodeMethod<>("EnqueueMessage", EnqueueMessageRequest.class, EnqueueMessageResponse.class,
					EnqueueMessageResponse::new);
	public static final NodeMethod<InternalRangeLookupRequest, InternalRangeLookupResponse> INTERNAL_RANGE_LOOKUP =
			new NodeMethod<>("InternalRangeLookup", InternalRangeLookupRequest.class,
					InternalRangeLookupResponse.class, InternalRangeLookupResponse::new);

	private static final List<NodeMethod<?, ?>> ALL = List.of(
			CONTAINS, GET, PUT, INCREMENT, DELETE, DELETE_RANGE, SCAN, END_TRANSACTION,
			ACCUMULATE_TS, REAP_QUEUE, ENQUEUE_UPDATE, ENQUEUE_MESSAGE, INTERNAL_RANGE_LOOKUP);

	private final String name;
	private final Class<Q> requestType;
	private final Class<R> responseType;
	private final Supplier<R> responseFactory;

	private NodeMethod(String name, Class<Q> requestType, Class<R> responseType, Supplier<R> responseFactory) {
		this.name = Objects.requireNonNull(name);
		this.requestType = requestType;
		this.responseType = responseType;
		this.responseFactory = responseFactory;
	}

	public static List<NodeMethod<?, ?>> values() {
		return ALL;
	}

	public String getName() {
		return name;
	}

	/**
	 * The method name as it appears on the wire, e.g. {@code Node/Get}.
	 */
	public String getFullName() {
		return SERVICE_NAME + "/" + name;
	}

	public Class<Q> getRequestType() {
		return requestType;
	}

	public Class<R> getResponseType() {
		return responseType;
	}

	public R newResponse() {
		return responseFactory.get();
	}

	@Override
	public String toString() {
		return getFullName();
	}
}
