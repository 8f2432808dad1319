package ru.r2cloud.utapi;

import java.util.List;

/**
 * Typed operations of the UploadThing REST API. Every call issues exactly one
 * request and fails with {@link UtApiException} on transport error, non-2xx
 * status or malformed response.
 */
public interface UtApi {

	DeleteFilesResponse deleteFiles(List<String> fileKeys) throws UtApiException;

	ListFilesResponse listFiles(ListRequest req) throws UtApiException;

	RenameFilesResponse renameFiles(List<RenameFileUpdate> updates) throws UtApiException;

	UsageInfo getUsageInfo() throws UtApiException;

	/**
	 * @param expiresIn seconds. 0 means provider default
	 */
	FileAccess requestFileAccess(String fileKey, int expiresIn) throws UtApiException;

	/**
	 * @return ufs url of the private file
	 */
	String getPresignedUrl(String fileKey, int expiresIn) throws UtApiException;

	AppInfo getAppInfo() throws UtApiException;

	UploadFilesResponse getPresignedUploadUrl(List<UploadFileInfo> files, Acl acl) throws UtApiException;

	UploadFilesResponse getPresignedUploadUrl(UploadFilesRequest req) throws UtApiException;
}
