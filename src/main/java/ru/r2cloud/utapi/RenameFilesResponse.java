package ru.r2cloud.utapi;

public class RenameFilesResponse {

	private boolean success;
	private int renamedCount;

	public boolean isSuccess() {
		return success;
	}

	public void setSuccess(boolean success) {
		this.success = success;
	}

	public int getRenamedCount() {
		return renamedCount;
	}

	public void setRenamedCount(int renamedCount) {
		this.renamedCount = renamedCount;
	}

}
