package ru.r2cloud.utapi;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map.Entry;

import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.mime.HttpMultipartMode;
import org.apache.http.entity.mime.MultipartEntityBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads content directly to the presigned S3-compatible url returned by
 * {@link UtApi#getPresignedUploadUrl(UploadFilesRequest)}. Api key is not
 * required.
 */
public class PresignedPostUploader {

	private static final Logger LOG = LoggerFactory.getLogger(PresignedPostUploader.class);
	private static final int BUFFER_SIZE = 8192;

	private int timeout = 10_000;

	private CloseableHttpClient httpclient;

	public void start() {
		httpclient = UploadThingClient.createClient(timeout);
	}

	public void stop() throws IOException {
		if (httpclient != null) {
			httpclient.close();
		}
	}

	public void upload(File file, PresignedPost presigned) throws UtApiException {
		if (LOG.isTraceEnabled()) {
			LOG.trace("uploading: {} to {}", file.getAbsolutePath(), presigned.getKey());
		}
		if (!file.isFile()) {
			throw new UtApiException(UtApiException.NOT_FOUND, "file not found: " + file.getAbsolutePath());
		}
		MultipartEntityBuilder builder = createBuilder(presigned);
		builder.addBinaryBody("file", file, ContentType.APPLICATION_OCTET_STREAM, presigned.getFileName());
		execute(builder.build(), presigned);
	}

	/**
	 * @param content can be null. Then empty file will be uploaded
	 * @param size    exact number of bytes to read from content
	 */
	public void upload(InputStream content, long size, PresignedPost presigned) throws UtApiException {
		if (LOG.isTraceEnabled()) {
			LOG.trace("uploading {} bytes to {}", size, presigned.getKey());
		}
		byte[] data;
		if (content != null && size > 0) {
			try {
				data = readFully(content, size);
			} catch (IOException e) {
				throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to read content", e);
			}
		} else {
			data = new byte[0];
		}
		MultipartEntityBuilder builder = createBuilder(presigned);
		builder.addBinaryBody("file", data, ContentType.APPLICATION_OCTET_STREAM, presigned.getFileName());
		execute(builder.build(), presigned);
	}

	private void execute(HttpEntity entity, PresignedPost presigned) throws UtApiException {
		if (httpclient == null) {
			throw new IllegalStateException("uploader is not started");
		}
		HttpPost method = new HttpPost(presigned.getUrl());
		method.setEntity(entity);
		CloseableHttpResponse response = null;
		try {
			response = httpclient.execute(method);
			int statusCode = response.getStatusLine().getStatusCode();
			if (statusCode < 200 || statusCode >= 300) {
				String body = UploadThingClient.readBody(response.getEntity());
				LOG.info("unable to upload {}: {}", presigned.getKey(), statusCode);
				throw new UtApiException(statusCode, "File upload error: " + statusCode + ": " + body);
			}
		} catch (IOException e) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to upload: " + presigned.getKey(), e);
		} finally {
			if (response != null) {
				EntityUtils.consumeQuietly(response.getEntity());
			}
		}
	}

	private static MultipartEntityBuilder createBuilder(PresignedPost presigned) {
		MultipartEntityBuilder result = MultipartEntityBuilder.create();
		result.setMode(HttpMultipartMode.BROWSER_COMPATIBLE);
		result.setCharset(StandardCharsets.UTF_8);
		if (presigned.getFields() != null) {
			for (Entry<String, String> cur : presigned.getFields().entrySet()) {
				if (cur.getValue() == null) {
					continue;
				}
				result.addTextBody(cur.getKey(), cur.getValue(), ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8));
			}
		}
		return result;
	}

	private static byte[] readFully(InputStream is, long size) throws IOException {
		if (size > Integer.MAX_VALUE) {
			throw new IOException("content is too big: " + size);
		}
		ByteArrayOutputStream baos = new ByteArrayOutputStream((int) Math.min(size, BUFFER_SIZE));
		byte[] buffer = new byte[BUFFER_SIZE];
		long remaining = size;
		while (remaining > 0) {
			int read = is.read(buffer, 0, (int) Math.min(buffer.length, remaining));
			if (read < 0) {
				throw new EOFException("expected " + size + " bytes, but got: " + (size - remaining));
			}
			baos.write(buffer, 0, read);
			remaining -= read;
		}
		return baos.toByteArray();
	}

	public void setTimeout(int timeout) {
		this.timeout = timeout;
	}
}
