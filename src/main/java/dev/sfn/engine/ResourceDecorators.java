package dev.sfn.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.model.DecoratorSchema;
import dev.sfn.model.OptionSchema;
import dev.sfn.model.ValueExtractor;
import dev.sfn.model.ValueKind;

import java.util.Map;

/**
 * Resource decorators that configure infrastructure around a state machine.
 * <ul>
 *   <li>{@code @export()} gives the state machine its own template and supporting
 *       infrastructure.</li>
 *   <li>{@code @schedule(expression="cron(0 12 * * ? *)")} creates an event rule that
 *       starts the state machine, optionally with {@code input_data}.</li>
 *   <li>{@code @subscribe(project="other-project")} or
 *       {@code @subscribe(topic_arn_import_value="${Environment}-topic")} starts the state
 *       machine when a message is published to another state machine's topic.</li>
 * </ul>
 */
public final class ResourceDecorators {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final ValueExtractor STRING = node -> JSON.textNode(ValueExtractors.string(node));
    private static final ValueExtractor BOOLEAN = node -> JSON.booleanNode(ValueExtractors.bool(node));
    private static final ValueExtractor DICT = ValueExtractors::dict;
    private static final ValueExtractor SUBSCRIBE_STATUS =
        node -> JSON.textNode(ValueExtractors.subscribeStatus(node));

    public static final Map<String, DecoratorSchema> REGISTRY = Map.of(
        "export", new DecoratorSchema(1,
            Map.of("enabled", OptionSchema.withDefault(ValueKind.BOOLEAN, BOOLEAN, JSON.booleanNode(true))),
            DecoratorSchema.Requirement.NONE),

        "schedule", new DecoratorSchema(1,
            Map.of(
                "expression", OptionSchema.of(ValueKind.STRING, STRING),
                "input_data", OptionSchema.of(ValueKind.DICT, DICT)),
            (values, origin) -> UnsupportedOperation.check(values.containsKey("expression"),
                "@schedule requires the 'expression' option", origin.position())),

        // The topic ARN import value may contain ${...} substitutions; the template
        // emitter resolves it with !Sub before !ImportValue.
        "subscribe", new DecoratorSchema(DecoratorSchema.UNLIMITED,
            Map.of(
                "topic_arn_import_value", OptionSchema.of(ValueKind.STRING, STRING),
                "project", OptionSchema.of(ValueKind.STRING, STRING),
                "state_machine", OptionSchema.withDefault(ValueKind.STRING, STRING, JSON.textNode("main")),
                "status", OptionSchema.withDefault(ValueKind.STRING, SUBSCRIBE_STATUS, JSON.textNode("success"))),
            (values, origin) -> UnsupportedOperation.check(
                values.containsKey("topic_arn_import_value") != values.containsKey("project"),
                "@subscribe requires exactly one of 'topic_arn_import_value' or 'project'",
                origin.position()))
    );

    private ResourceDecorators() {}
}
