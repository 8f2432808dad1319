package ru.r2cloud.utapi;

public class UsageInfo {

	private long totalBytes;
	private long appTotalBytes;
	private int filesUploaded;
	private long limitBytes;

	public long getTotalBytes() {
		return totalBytes;
	}

	public void setTotalBytes(long totalBytes) {
		this.totalBytes = totalBytes;
	}

	public long getAppTotalBytes() {
		return appTotalBytes;
	}

	public void setAppTotalBytes(long appTotalBytes) {
		this.appTotalBytes = appTotalBytes;
	}

	public int getFilesUploaded() {
		return filesUploaded;
	}

	public void setFilesUploaded(int filesUploaded) {
		this.filesUploaded = filesUploaded;
	}

	public long getLimitBytes() {
		return limitBytes;
	}

	public void setLimitBytes(long limitBytes) {
		this.limitBytes = limitBytes;
	}

	@Override
	public String toString() {
		return "UsageInfo [totalBytes=" + totalBytes + ", appTotalBytes=" + appTotalBytes + ", filesUploaded=" + filesUploaded + ", limitBytes=" + limitBytes + "]";
	}

}
