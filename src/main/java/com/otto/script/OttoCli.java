package com.otto.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.otto.debug.Debug;
import com.otto.debug.DebugLevel;
import com.otto.script.store.DefaultShapeFactory;
import com.otto.script.store.InMemoryParameterStore;
import com.otto.script.store.InMemoryShapeStore;

/**
 * Runs a script file against empty in-memory stores and prints the run result together
 * with the resulting shapes and parameters as JSON.
 */
public final class OttoCli {

    private static final String USAGE = "Usage: OttoCli [--debug] [--result] <script-file>";

    public static void main(String[] args) {
        Path scriptPath = null;
        boolean printResult = false;
        for (String arg : args) {
            if (arg.equals("--debug")) {
                Debug.get().setLevel(DebugLevel.DEBUG);
            } else if (arg.equals("--result")) {
                printResult = true;
            } else if (arg.startsWith("--") || scriptPath != null) {
                System.err.println(USAGE);
                System.exit(2);
                return;
            } else {
                scriptPath = Path.of(arg);
            }
        }
        if (scriptPath == null) {
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        InMemoryShapeStore shapes = new InMemoryShapeStore();
        InMemoryParameterStore parameters = new InMemoryParameterStore();
        ScriptRunner runner = new ScriptRunner(shapes, parameters, new DefaultShapeFactory());
        RunResult result = runner.run(script);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("result", result);
        if (printResult && result.isSuccess()) {
            out.put("lastValue", result.getInterpretResult().getResult().toJava());
        }
        out.put("parameters", parameters.getAll());
        out.put("shapes", shapes.getAll());

        try {
            System.out.println(toJson(out));
        } catch (JsonProcessingException e) {
            System.err.println("Failed to render result: " + e.getMessage());
            System.exit(3);
            return;
        }
        if (!result.isSuccess()) System.exit(1);
    }

    static String toJson(Object value) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        return mapper.writeValueAsString(value);
    }

    private OttoCli() {}
}
