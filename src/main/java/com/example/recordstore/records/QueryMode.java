package com.example.recordstore.records;

public enum QueryMode {

	ACTIVE_ONLY, INCLUDE_DELETED, DELETED_ONLY

}
