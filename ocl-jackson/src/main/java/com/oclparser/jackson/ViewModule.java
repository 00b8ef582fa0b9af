package com.oclparser.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.oclparser.view.ViewValue;

/**
 * Jackson module that writes views as plain JSON.
 */
public class ViewModule extends SimpleModule {

    public ViewModule() {
        super("ViewModule", new Version(0, 1, 0, null, "com.oclparser", "ocl-jackson"));
        addSerializer(ViewValue.class, new ViewValueSerializer());
    }
}
