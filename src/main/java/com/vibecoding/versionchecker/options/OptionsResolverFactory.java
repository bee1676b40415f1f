package com.vibecoding.versionchecker.options;

import java.util.Map;

/**
 * Pod 어노테이션으로 {@link OptionsResolver} 생성
 */
public interface OptionsResolverFactory {

    OptionsResolver forAnnotations(Map<String, String> annotations);
}
