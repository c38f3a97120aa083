package dev.sfn.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.model.DecoratorEffect;
import dev.sfn.model.DecoratorSchema;
import dev.sfn.model.OptionSchema;
import dev.sfn.syntax.Decorator;
import dev.sfn.syntax.FunctionDef;
import dev.sfn.syntax.Keyword;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Validates the resource decorators on a function against a schema registry and
 * resolves their option values.
 */
public final class DecoratorValidator {

    private DecoratorValidator() {}

    /**
     * Validate every decorator on {@code function} against {@link ResourceDecorators#REGISTRY}.
     *
     * @return one effect per decorator application, in source order
     * @throws UnsupportedOperation on the first violation
     */
    public static List<DecoratorEffect> validate(FunctionDef function) {
        return validate(function, ResourceDecorators.REGISTRY);
    }

    public static List<DecoratorEffect> validate(FunctionDef function, Map<String, DecoratorSchema> registry) {
        var effects = new ArrayList<DecoratorEffect>();
        var counts = new HashMap<String, Integer>();

        for (Decorator decorator : function.decorators()) {
            DecoratorSchema schema = registry.get(decorator.name());
            if (schema == null) {
                throw new UnsupportedOperation("Unsupported decorator @%s. Supported decorators: %s"
                    .formatted(decorator.name(), String.join(", ", new TreeSet<>(registry.keySet()))),
                    decorator.position());
            }

            int seen = counts.getOrDefault(decorator.name(), 0);
            if (seen >= schema.maxCount()) {
                throw new UnsupportedOperation("@%s can be applied at most %d time%s per function"
                    .formatted(decorator.name(), schema.maxCount(), schema.maxCount() == 1 ? "" : "s"),
                    decorator.position());
            }
            counts.put(decorator.name(), seen + 1);

            effects.add(apply(decorator, schema));
        }
        return effects;
    }

    /**
     * Resolve the options of a single decorator application.
     */
    public static DecoratorEffect apply(Decorator decorator, DecoratorSchema schema) {
        if (!decorator.args().isEmpty()) {
            throw new UnsupportedOperation(
                "@%s only accepts keyword arguments".formatted(decorator.name()),
                decorator.args().get(0).position());
        }

        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (Keyword keyword : decorator.keywords()) {
            OptionSchema option = schema.options().get(keyword.name());
            if (option == null) {
                throw new UnsupportedOperation("Unsupported option '%s' for @%s. Supported options: %s"
                    .formatted(keyword.name(), decorator.name(), String.join(", ", new TreeSet<>(schema.options().keySet()))),
                    keyword.position());
            }
            if (values.containsKey(keyword.name())) {
                throw new UnsupportedOperation(
                    "Option '%s' is repeated".formatted(keyword.name()), keyword.position());
            }
            if (!option.kind().accepts(keyword.value())) {
                throw new UnsupportedOperation("Option '%s' of @%s must be a %s literal"
                    .formatted(keyword.name(), decorator.name(), option.kind().label()),
                    keyword.value().position());
            }
            values.put(keyword.name(), option.extractor().extract(keyword.value()));
        }

        for (String name : new TreeSet<>(schema.options().keySet())) {
            OptionSchema option = schema.options().get(name);
            if (!values.containsKey(name) && option.hasDefault()) {
                values.put(name, option.defaultValue().deepCopy());
            }
        }

        schema.requirement().check(values, decorator);
        return new DecoratorEffect(decorator.name(), Collections.unmodifiableMap(values), decorator);
    }
}
