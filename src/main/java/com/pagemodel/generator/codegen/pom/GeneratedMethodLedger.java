package com.pagemodel.generator.codegen.pom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Generated method name to signature. A name registered with two different signatures
 * becomes ambiguous and stays so.
 */
public class GeneratedMethodLedger {

    private final Map<String, Optional<MethodSignature>> signatures = new LinkedHashMap<>();

    public void register(String name, MethodSignature signature) {
        Optional<MethodSignature> previous = signatures.get(name);
        if (previous == null) {
            signatures.put(name, Optional.ofNullable(signature));
            return;
        }
        if (previous.isEmpty()) {
            return;
        }
        if (signature == null || !previous.get().equals(signature)) {
            signatures.put(name, Optional.empty());
        }
    }

    public boolean contains(String name) {
        return signatures.containsKey(name);
    }

    public boolean isAmbiguous(String name) {
        Optional<MethodSignature> signature = signatures.get(name);
        return signature != null && signature.isEmpty();
    }

    /**
     * @return the signature, or empty when unknown or ambiguous
     */
    public Optional<MethodSignature> signatureOf(String name) {
        Optional<MethodSignature> signature = signatures.get(name);
        return signature == null ? Optional.empty() : signature;
    }

    /**
     * True when {@code name} is bound to a signature other than {@code signature}.
     */
    public boolean conflicts(String name, MethodSignature signature) {
        Optional<MethodSignature> existing = signatures.get(name);
        if (existing == null) {
            return false;
        }
        return existing.isEmpty() || !existing.get().equals(signature);
    }

    public Map<String, Optional<MethodSignature>> asMap() {
        return Collections.unmodifiableMap(signatures);
    }

    public int size() {
        return signatures.size();
    }
}
