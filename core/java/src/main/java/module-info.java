module io.github.cyfko.eqschema.core {
    requires java.logging;

    exports io.github.cyfko.eqschema.core;
    exports io.github.cyfko.eqschema.core.api;
    exports io.github.cyfko.eqschema.core.cache;
    exports io.github.cyfko.eqschema.core.config;
    exports io.github.cyfko.eqschema.core.exception;
    exports io.github.cyfko.eqschema.core.impl;
    exports io.github.cyfko.eqschema.core.lexing;
    exports io.github.cyfko.eqschema.core.parsing;
    exports io.github.cyfko.eqschema.core.printing;
}
