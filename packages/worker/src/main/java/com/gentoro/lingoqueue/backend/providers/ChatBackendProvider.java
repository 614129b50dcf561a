package com.gentoro.lingoqueue.backend.providers;

import com.gentoro.lingoqueue.backend.ChatCompletionBackend;
import com.gentoro.lingoqueue.backend.TranslationBackend;
import com.gentoro.lingoqueue.backend.spi.TranslationBackendProvider;
import org.apache.commons.configuration2.Configuration;

public class ChatBackendProvider implements TranslationBackendProvider {
  @Override
  public String id() {
    return ChatCompletionBackend.ID;
  }

  @Override
  public TranslationBackend create(Configuration configuration) {
    return ChatCompletionBackend.create(configuration);
  }
}
