package com.vibecoding.versionchecker.options;

import com.vibecoding.versionchecker.exception.InvalidAnnotationException;
import com.vibecoding.versionchecker.model.ImageOptions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.vibecoding.versionchecker.options.OptionsAnnotations.*;

/**
 * 어노테이션 기반 옵션 해석기
 * Pod 단위로 생성되어 모든 컨테이너가 공유한다.
 */
public class AnnotationOptionsResolver implements OptionsResolver {

    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("[0-9]+");

    private final Map<String, String> annotations;

    public AnnotationOptionsResolver(Map<String, String> annotations) {
        this.annotations = annotations != null ? new HashMap<>(annotations) : Map.of();
    }

    @Override
    public boolean isEnabled(boolean defaultEnabled, String containerName) {
        String enable = annotations.get(key(ENABLE, containerName));
        return (defaultEnabled && enable == null) || "true".equals(enable);
    }

    @Override
    public ImageOptions options(String containerName) {
        ImageOptions.ImageOptionsBuilder builder = ImageOptions.builder();
        List<String> errors = new ArrayList<>();
        boolean semverOptionSet = false;

        boolean useSha = isTrue(containerName, USE_SHA);
        builder.useSha(useSha);
        builder.resolveShaToTags(isTrue(containerName, RESOLVE_SHA_TO_TAGS));

        if (isTrue(containerName, USE_METADATA)) {
            builder.useMetadata(true);
            semverOptionSet = true;
        }

        String regex = annotations.get(key(MATCH_REGEX, containerName));
        if (regex != null) {
            semverOptionSet = true;
            try {
                Pattern.compile(regex);
                builder.matchRegex(regex);
            } catch (PatternSyntaxException e) {
                errors.add(String.format("failed to compile regex at annotation \"%s\": %s",
                    key(MATCH_REGEX, containerName), e.getDescription()));
            }
        }

        semverOptionSet |= parsePin(containerName, PIN_MAJOR, builder::pinMajor, errors);
        semverOptionSet |= parsePin(containerName, PIN_MINOR, builder::pinMinor, errors);
        semverOptionSet |= parsePin(containerName, PIN_PATCH, builder::pinPatch, errors);

        String overrideUrl = annotations.get(key(OVERRIDE_URL, containerName));
        if (overrideUrl != null) {
            builder.overrideUrl(overrideUrl);
        }

        if (useSha && semverOptionSet) {
            errors.add(String.format("cannot define \"%s\" with any semver options", key(USE_SHA, containerName)));
        }

        if (!errors.isEmpty()) {
            throw new InvalidAnnotationException(
                "failed to build version check options: " + String.join(", ", errors));
        }
        return builder.build();
    }

    private boolean isTrue(String containerName, String prefix) {
        return "true".equals(annotations.get(key(prefix, containerName)));
    }

    /**
     * @return 어노테이션이 존재하면 true (값이 잘못되어도)
     */
    private boolean parsePin(String containerName, String prefix, Consumer<Long> setter, List<String> errors) {
        String annotation = key(prefix, containerName);
        String value = annotations.get(annotation);
        if (value == null) {
            return false;
        }
        // 부호, 공백 없이 숫자만 허용
        if (!UNSIGNED_INTEGER.matcher(value).matches()) {
            errors.add(String.format("failed to parse \"%s\": invalid syntax \"%s\"", annotation, value));
            return true;
        }
        try {
            setter.accept(Long.parseLong(value));
        } catch (NumberFormatException e) {
            errors.add(String.format("failed to parse \"%s\": value out of range \"%s\"", annotation, value));
        }
        return true;
    }
}
