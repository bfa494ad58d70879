package me.golemcore.taskcore.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.CapabilityDescriptor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Name to capability map shared by the tool-calling loop and the plugin host.
 *
 * <p>
 * The entry map is immutable and replaced as a whole under a write lock, so
 * readers ({@link #invoke}, {@link #listDefinitions}) never see a half-applied
 * update. Registering an existing name replaces the earlier entry.
 */
@Service
@Slf4j
public class CapabilityRegistry {

    private final Object writeLock = new Object();
    private volatile Map<String, CapabilityDescriptor> entries = Map.of();

    public void register(CapabilityDescriptor descriptor) {
        replace(List.of(), List.of(descriptor));
    }

    public boolean unregister(String name) {
        synchronized (writeLock) {
            if (!entries.containsKey(name)) {
                return false;
            }
            Map<String, CapabilityDescriptor> next = new LinkedHashMap<>(entries);
            next.remove(name);
            entries = Collections.unmodifiableMap(next);
        }
        log.info("[Capabilities] unregistered '{}'", name);
        return true;
    }

    /**
     * Remove {@code removeNames} and add {@code additions} in one visible step.
     */
    public void replace(Collection<String> removeNames, Collection<CapabilityDescriptor> additions) {
        for (CapabilityDescriptor descriptor : additions) {
            validate(descriptor);
        }
        synchronized (writeLock) {
            Map<String, CapabilityDescriptor> next = new LinkedHashMap<>(entries);
            for (String name : removeNames) {
                next.remove(name);
            }
            for (CapabilityDescriptor descriptor : additions) {
                CapabilityDescriptor previous = next.put(descriptor.getName(), descriptor);
                if (previous != null) {
                    log.debug("[Capabilities] replaced '{}' (owner {} -> {})", descriptor.getName(),
                            previous.getOwner(), descriptor.getOwner());
                }
            }
            entries = Collections.unmodifiableMap(next);
        }
        if (!additions.isEmpty() || !removeNames.isEmpty()) {
            log.debug("[Capabilities] now {} registered", entries.size());
        }
    }

    public Optional<CapabilityDescriptor> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    /**
     * Names registered by the given owner (plugin name or builtin).
     */
    public Set<String> namesOwnedBy(String owner) {
        Set<String> names = new TreeSet<>();
        for (CapabilityDescriptor descriptor : entries.values()) {
            if (Objects.equals(owner, descriptor.getOwner())) {
                names.add(descriptor.getName());
            }
        }
        return names;
    }

    /**
     * Schemas of every registered capability, sorted by name.
     */
    public List<CapabilityDefinition> listDefinitions() {
        return entries.values().stream()
                .sorted(Comparator.comparing(CapabilityDescriptor::getName))
                .map(CapabilityDescriptor::toDefinition)
                .toList();
    }

    /**
     * Invoke a capability by name. Never throws: unknown names and failures are
     * returned as descriptive strings the model can react to.
     */
    public String invoke(String name, Map<String, Object> arguments) {
        CapabilityDescriptor descriptor = entries.get(name);
        if (descriptor == null) {
            log.warn("[Capabilities] unknown capability requested: '{}'", name);
            return "Error: capability '" + name + "' not found";
        }
        try {
            String result = descriptor.getInvoker().invoke(arguments != null ? arguments : Map.of());
            return result != null ? result : "(no output)";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Error executing '" + name + "': interrupted";
        } catch (Exception e) { // NOSONAR - capability failures are reported to the model
            Throwable cause = unwrap(e);
            log.warn("[Capabilities] '{}' failed: {}", name, cause.getMessage(), cause);
            return "Error executing '" + name + "': " + cause.getMessage();
        }
    }

    private Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void validate(CapabilityDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        Objects.requireNonNull(descriptor.getInvoker(), "invoker for " + descriptor.getName());
    }
}
