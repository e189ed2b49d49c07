package com.example.recordstore.records;

public final class QueryModeResolver {

	private QueryModeResolver() {
	}

	public static QueryMode resolve(Object showDeleted) {
		return isTrue(showDeleted) ? QueryMode.INCLUDE_DELETED : QueryMode.ACTIVE_ONLY;
	}

	public static QueryMode resolve(Object showDeleted, Object onlyDeleted) {
		if (isTrue(onlyDeleted)) {
			return QueryMode.DELETED_ONLY;
		}
		return resolve(showDeleted);
	}

	static boolean isTrue(Object rawValue) {
		if (rawValue instanceof Boolean bool) {
			return bool;
		}
		if (rawValue instanceof CharSequence text) {
			return "true".equalsIgnoreCase(text.toString().strip());
		}
		return false;
	}

}
