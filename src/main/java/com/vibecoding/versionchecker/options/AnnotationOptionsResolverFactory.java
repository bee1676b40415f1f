package com.vibecoding.versionchecker.options;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AnnotationOptionsResolverFactory implements OptionsResolverFactory {

    @Override
    public OptionsResolver forAnnotations(Map<String, String> annotations) {
        return new AnnotationOptionsResolver(annotations);
    }
}
