package com.gentoro.lingoqueue.backend.providers;

import com.gentoro.lingoqueue.backend.CacheGrpcBackend;
import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import org.apache.commons.configuration2.Configuration;

public class CacheGrpcBackendProvider implements TranslationBackendProvider {
  @Override
  public String id() {
    return CacheGrpcBackend.ID;
  }

  @Override
  public TranslationBackend create(Configuration configuration) {
    return CacheGrpcBackend.create(configuration);
  }
}
