package io.pipewright.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.pipewright.core.ir.Node;
import java.io.Serial;

/// Jackson module registering the IR serializer/deserializer pair.
///
/// `Node` is written with a `"nodeType"` discriminator; callables are written as names
/// resolved through the module's {@link CallableRegistry}.
///
/// @see PipelineSerializer for the convenience API
public class PipewrightJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127745015093313920L;

    public PipewrightJacksonModule(CallableRegistry registry) {
        super("PipewrightJacksonModule");

        addSerializer(Node.class, new NodeSerializer(registry));
        addDeserializer(Node.class, new NodeDeserializer(registry));
    }
}
