package com.traceradar.config;

import com.traceradar.domain.AccountId;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * Reads raw-form addresses from MongoDB as AccountId.
 */
@ReadingConverter
public class StringToAccountIdConverter implements Converter<String, AccountId> {

    @Override
    public AccountId convert(String source) {
        return source == null ? null : AccountId.parse(source);
    }
}
