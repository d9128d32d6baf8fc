package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class EISDIRException extends IOException {
	protected String path;


	public EISDIRException(String path) {
		super(path + ": is directory");
		this.path = path;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = 5561756629473381223L;

	public String getPath() {
		return path;
	}
}
