package com.eyelevel.documenttranslator.service.translation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class TranslationRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Translation call failed on attempt {}: {}. Retrying if attempts remain.", context.getRetryCount(),
                throwable.getMessage());
    }
}
