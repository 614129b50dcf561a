package com.gentoro.lingoqueue.backend.providers;

import com.gentoro.lingoqueue.backend.CacheHttpBackend;
import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import org.apache.commons.configuration2.Configuration;

public class CacheHttpBackendProvider implements TranslationBackendProvider {
  @Override
  public String id() {
    return CacheHttpBackend.ID;
  }

  @Override
  public TranslationBackend create(Configuration configuration) {
    return CacheHttpBackend.create(configuration);
  }
}
