package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

/** Raised when a write is routed at a layer that cannot accept it, e.g. a path that only exists in
 * a lower overlay layer. */
public class EROFSException extends IOException {
	protected String path;

	public EROFSException(String path) {
		super(path + ": read-only file system");
		this.path = path;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = 3208842146716302757L;

	public String getPath() {
		return path;
	}
}
