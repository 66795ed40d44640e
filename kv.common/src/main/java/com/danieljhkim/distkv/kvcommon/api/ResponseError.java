package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.exception.KvException;
import com.danieljhkim.distkv.kvcommon.exception.RemoteException;

import io.grpc.Status;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The error slot of a {@link KvResponse}.
 *
 * <p>
 * Errors raised locally keep the original exception so callers can inspect its
 * type; errors received from a storage node carry only the code, message and
 * retry classification.
 */
@Getter
@Setter
@NoArgsConstructor
public class ResponseError {

	private Status.Code code;
	private String message;
	private boolean retryable;

	@Getter(AccessLevel.NONE)
	@Setter(AccessLevel.NONE)
	private transient Throwable cause;

	public ResponseError(Status.Code code, String message, boolean retryable) {
		this.code = code;
		this.message = message;
		this.retryable = retryable;
	}

	public static ResponseError from(Throwable t) {
		ResponseError error;
		if (t instanceof KvException kv) {
			error = new ResponseError(kv.getGrpcStatusCode(), kv.getMessage(), kv.isRetryable());
		} else {
			error = new ResponseError(Status.Code.INTERNAL, String.valueOf(t.getMessage()), false);
		}
		error.cause = t;
		return error;
	}

	/**
	 * Returns the exception this error describes.
	 */
	public RuntimeException toException() {
		if (cause instanceof RuntimeException re) {
			return re;
		}
		return new RemoteException(code, message, retryable);
	}

	@Override
	public String toString() {
		return "ResponseError{code=" + code + ", message='" + message + "', retryable=" + retryable + '}';
	}
}
