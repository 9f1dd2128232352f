package com.nevis.dossier.controller;

import com.nevis.dossier.model.DocumentCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets {@code ?category=} take the wire label ({@code pv_ag}) as well as the enum name.
 */
@Component
public class CategoryParameterConverter implements Converter<String, DocumentCategory> {

    @Override
    public DocumentCategory convert(String source) {
        return DocumentCategory.fromJson(source.trim());
    }
}
