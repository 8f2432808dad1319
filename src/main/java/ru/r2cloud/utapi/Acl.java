package ru.r2cloud.utapi;

public enum Acl {

	PUBLIC_READ("public-read"), PRIVATE("private");

	private final String value;

	private Acl(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static Acl fromValue(String value) {
		for (Acl cur : values()) {
			if (cur.value.equals(value)) {
				return cur;
			}
		}
		return null;
	}
}
