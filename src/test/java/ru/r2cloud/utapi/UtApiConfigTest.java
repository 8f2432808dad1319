package ru.r2cloud.utapi;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.Collections;
import java.util.UUID;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class UtApiConfigTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	@Test
	public void testLoadFromDotEnv() throws Exception {
		File dotEnv = createDotEnv("# uploadthing\n\nOTHER=1\nUPLOADTHING_SECRET=\"sk_live_123\"\n");
		UtApiConfig config = UtApiConfig.load(dotEnv, Collections.emptyMap());
		assertEquals("sk_live_123", config.getApiKey());
		assertEquals("https://api.uploadthing.com", config.getHost());
		assertEquals("7.6.0", config.getVersion());
	}

	@Test
	public void testEnvironmentTakesPrecedence() throws Exception {
		File dotEnv = createDotEnv("UPLOADTHING_SECRET=from-file\n");
		UtApiConfig config = UtApiConfig.load(dotEnv, Collections.singletonMap(UtApiConfig.SECRET_VARIABLE, "from-env"));
		assertEquals("from-env", config.getApiKey());
	}

	@Test
	public void testMissingDotEnv() throws Exception {
		File dotEnv = new File(tempFolder.getRoot(), UUID.randomUUID().toString());
		UtApiConfig config = UtApiConfig.load(dotEnv, Collections.singletonMap(UtApiConfig.SECRET_VARIABLE, "from-env"));
		assertEquals("from-env", config.getApiKey());
	}

	@Test
	public void testMissingSecret() throws Exception {
		File dotEnv = createDotEnv("OTHER=1\n");
		try {
			UtApiConfig.load(dotEnv, Collections.emptyMap());
			fail("exception expected");
		} catch (UtApiException e) {
			assertEquals(UtApiException.INTERNAL_SERVER_ERROR, e.getCode());
			assertEquals("UPLOADTHING_SECRET is not set", e.getMessage());
		}
	}

	@Test
	public void testInlineComment() throws Exception {
		File dotEnv = createDotEnv("UPLOADTHING_SECRET=sk_live_abc # prod key\n");
		UtApiConfig config = UtApiConfig.load(dotEnv, Collections.emptyMap());
		assertEquals("sk_live_abc", config.getApiKey());
	}

	@Test
	public void testQuotedValueWithHash() throws Exception {
		File dotEnv = createDotEnv("UPLOADTHING_SECRET=\"sk_live_#abc\" # prod key\n");
		UtApiConfig config = UtApiConfig.load(dotEnv, Collections.emptyMap());
		assertEquals("sk_live_#abc", config.getApiKey());
	}

	@Test(expected = UtApiException.class)
	public void testEmptySecret() throws Exception {
		UtApiConfig.load(createDotEnv("UPLOADTHING_SECRET=\n"), Collections.emptyMap());
	}

	private File createDotEnv(String data) throws IOException {
		File result = new File(tempFolder.getRoot(), ".env");
		try (FileWriter fw = new FileWriter(result)) {
			fw.append(data);
		}
		return result;
	}
}
