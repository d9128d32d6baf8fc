package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class InvalidArchiveVersionException extends IOException {
	protected int version;

	public InvalidArchiveVersionException(int version) {
		super("Unsupported archive version: " + version);
		this.version = version;
	}

	public int getVersion() {
		return version;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
}
