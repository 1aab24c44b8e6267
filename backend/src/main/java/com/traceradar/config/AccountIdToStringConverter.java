package com.traceradar.config;

import com.traceradar.domain.AccountId;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * Writes AccountId to MongoDB in raw form ("0:83df...").
 */
@WritingConverter
public class AccountIdToStringConverter implements Converter<AccountId, String> {

    @Override
    public String convert(AccountId source) {
        return source == null ? null : source.toRaw();
    }
}
