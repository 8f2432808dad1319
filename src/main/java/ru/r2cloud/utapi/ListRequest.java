package ru.r2cloud.utapi;

public class ListRequest {

	private int limit = 500;
	private int offset;

	public ListRequest() {
		// do nothing
	}

	public ListRequest(int limit, int offset) {
		this.limit = limit;
		this.offset = offset;
	}

	public int getLimit() {
		return limit;
	}

	public void setLimit(int limit) {
		this.limit = limit;
	}

	public int getOffset() {
		return offset;
	}

	public void setOffset(int offset) {
		this.offset = offset;
	}

	@Override
	public String toString() {
		return "ListRequest [limit=" + limit + ", offset=" + offset + "]";
	}

}
