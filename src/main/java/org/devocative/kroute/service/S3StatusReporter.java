package org.devocative.kroute.service;

import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.iservice.IStatusReporter;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@Slf4j
public class S3StatusReporter implements IStatusReporter {
	private final S3Client s3Client;
	private final String bucket;
	private final String key;

	public S3StatusReporter(S3Client s3Client, String bucket, String key) {
		this.s3Client = s3Client;
		this.bucket = bucket;
		this.key = key;
	}

	@Override
	public void write(String jsonDocument) {
		final var request = PutObjectRequest.builder()
			.bucket(bucket)
			.key(key)
			.contentType("application/json")
			.cacheControl("no-cache")
			.build();

		try {
			s3Client.putObject(request, RequestBody.fromString(jsonDocument));
			log.debug("Status Written: bucket=[{}] key=[{}]", bucket, key);
		} catch (SdkException e) {
			throw new KrouteException(e, "Status Write Failed: bucket=[%s] key=[%s]", bucket, key);
		}
	}
}
