package com.example.recordstore.records;

public class RecordStoreException extends RuntimeException {

	public RecordStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
