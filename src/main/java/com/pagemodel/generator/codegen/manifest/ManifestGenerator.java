package com.pagemodel.generator.codegen.manifest;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.pom.GeneratedIdentifierEntry;
import com.pagemodel.generator.codegen.pom.MethodSignature;
import com.pagemodel.generator.codegen.pom.PomExtraMethod;
import com.pagemodel.generator.codegen.pom.PomParameter;
import com.pagemodel.generator.codegen.pom.PomSpec;
import com.pagemodel.generator.codegen.pom.UnitAggregate;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the per-unit aggregates as JSON documents: the identifier manifest (unit to
 * sorted identifiers) and a structured page-object model dump for downstream renderers.
 */
public class ManifestGenerator {
    private static final Logger log = LoggerFactory.getLogger(ManifestGenerator.class);

    public static final String TEST_ID_MANIFEST = "testid-manifest.json";
    public static final String PAGE_OBJECT_MODEL = "page-object-model.json";

    private final Configuration freemarkerConfig;

    public ManifestGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String renderTestIdManifest(List<UnitAggregate> aggregates) throws IOException {
        List<Map<String, Object>> units = new ArrayList<>();
        for (UnitAggregate aggregate : aggregates) {
            Map<String, Object> unit = new LinkedHashMap<>();
            unit.put("name", aggregate.getUnitName());
            unit.put("identifiers", aggregate.getAllIdentifiers());
            units.add(unit);
        }
        return render(TEST_ID_MANIFEST + ".ftl", Map.of("units", units));
    }

    public String renderPageObjectModel(List<UnitAggregate> aggregates) throws IOException {
        List<Map<String, Object>> units = new ArrayList<>();
        for (UnitAggregate aggregate : aggregates) {
            units.add(unitModel(aggregate));
        }
        return render(PAGE_OBJECT_MODEL + ".ftl", Map.of("units", units));
    }

    private String render(String templateName, Map<String, Object> model) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
        log.debug("Rendered {} ({} chars)", templateName, out.getBuffer().length());
        return out.toString();
    }

    private static Map<String, Object> unitModel(UnitAggregate aggregate) {
        Map<String, Object> unit = new LinkedHashMap<>();
        unit.put("name", aggregate.getUnitName());
        unit.put("file", aggregate.getFilePath());
        unit.put("view", aggregate.isView());
        unit.put("usedComponents", new ArrayList<>(aggregate.getUsedComponents()));
        unit.put("childComponents", new ArrayList<>(aggregate.getChildComponents()));

        List<Map<String, Object>> entries = new ArrayList<>();
        for (GeneratedIdentifierEntry entry : aggregate.getEntries()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("identifier", entry.getIdentifier().getText());
            model.put("kind", entry.getIdentifier().getKind().name().toLowerCase());
            model.put("tag", entry.getTag());
            model.put("location", String.valueOf(entry.getLocation()));
            putIfPresent(model, "target", entry.getTarget());
            putIfPresent(model, "getter", entry.getPom() == null ? null : entry.getPom().getGetterName());
            model.put("fromExisting", entry.isFromExisting());
            model.put("insideScopedSlot", entry.isInsideScopedSlot());
            entries.add(model);
        }
        unit.put("entries", entries);

        List<Map<String, Object>> primaries = new ArrayList<>();
        for (PomSpec spec : aggregate.getPrimaries()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("role", spec.getRole().getId());
            model.put("baseName", spec.getBaseName());
            model.put("getter", spec.getGetterName());
            model.put("action", spec.getActionName());
            model.put("pattern", spec.getPattern());
            model.put("alternatePatterns", spec.getAlternatePatterns());
            model.put("parameters", parameterTexts(spec.getParameters()));
            putIfPresent(model, "keyValues", spec.getKeyValues());
            putIfPresent(model, "mergeKey", spec.getMergeKey());
            putIfPresent(model, "target", spec.getTarget());
            model.put("emitPrimary", spec.isEmitPrimary());
            primaries.add(model);
        }
        unit.put("primaries", primaries);

        List<Map<String, Object>> extraMethods = new ArrayList<>();
        for (PomExtraMethod method : aggregate.getExtraMethods()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("kind", method.getKind());
            model.put("name", method.getName());
            model.put("pattern", method.getPattern());
            putIfPresent(model, "keyLiteral", method.getKeyLiteral());
            model.put("parameters", parameterTexts(method.getParameters()));
            extraMethods.add(model);
        }
        unit.put("extraMethods", extraMethods);

        List<Map<String, Object>> ledger = new ArrayList<>();
        for (Map.Entry<String, Optional<MethodSignature>> entry : aggregate.getLedger().asMap().entrySet()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("name", entry.getKey());
            entry.getValue().ifPresent(signature -> model.put("signature", signature.toString()));
            ledger.add(model);
        }
        unit.put("ledger", ledger);
        return unit;
    }

    private static List<String> parameterTexts(List<PomParameter> parameters) {
        List<String> texts = new ArrayList<>();
        for (PomParameter parameter : parameters) {
            texts.add(parameter.toString());
        }
        return texts;
    }

    private static void putIfPresent(Map<String, Object> model, String key, Object value) {
        if (value != null) {
            model.put(key, value);
        }
    }
}
