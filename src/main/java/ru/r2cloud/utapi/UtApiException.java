package ru.r2cloud.utapi;

public class UtApiException extends Exception {

	private static final long serialVersionUID = 4263918260544327218L;

	public static final int NOT_FOUND = 404;
	public static final int INTERNAL_SERVER_ERROR = 503;

	private int code;

	public UtApiException(int code, String message, Throwable e) {
		super(message, e);
		this.code = code;
	}

	public UtApiException(int code, String message) {
		super(message);
		this.code = code;
	}

	/**
	 * @return http status when provider replied with non-2xx, otherwise
	 *         {@link #INTERNAL_SERVER_ERROR}
	 */
	public int getCode() {
		return code;
	}

}
