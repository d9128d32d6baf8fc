package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class InvalidArchiveHeaderException extends IOException {
	public InvalidArchiveHeaderException(String message) {
		super(message);
	}

	public InvalidArchiveHeaderException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
}
