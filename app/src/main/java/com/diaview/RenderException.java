package com.diaview;

import java.io.IOException;

/**
 * Failure of one step of loading or rendering a layered archive. Carries the
 * reason and the id, filename or archive path that caused it.
 */
public class RenderException extends IOException
{

	public enum Reason
	{
		INVALID_ARGUMENT,
		OPEN_FAILED,
		READ_FAILED,
		NOT_FOUND,
		ASSET_NOT_FOUND,
		DECODE_FAILED,
		CIRCULAR_DEPENDENCY,
		MALFORMED_MANIFEST
	}

	private final Reason reason;
	private final String subject;

	public RenderException(Reason reason, String subject, String message)
	{
		this(reason, subject, message, null);
	}

	public RenderException(Reason reason, String subject, String message, Throwable cause)
	{
		super(message, cause);
		this.reason = reason;
		this.subject = subject;
	}

	public Reason reason()
	{
		return reason;
	}

	/** The offending asset id, entry filename or archive path; may be null. */
	public String subject()
	{
		return subject;
	}

	static RenderException invalidArgument(String message)
	{
		return new RenderException(Reason.INVALID_ARGUMENT, null, message);
	}

	static RenderException assetNotFound(String id)
	{
		return new RenderException(Reason.ASSET_NOT_FOUND, id, "Could not find filename for ID '" + id + "'");
	}

	static RenderException circularDependency(String id)
	{
		return new RenderException(Reason.CIRCULAR_DEPENDENCY, id, "Circular dependency detected involving ID '" + id + "'");
	}
}
