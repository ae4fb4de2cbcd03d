package dev.mars.pgprojection.pg.events;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event payload classes to the type names stored in the event log.
 *
 * <p>Unregistered classes are stored under their fully qualified name and resolved by
 * class loading when read back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class EventTypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EventTypeRegistry.class);

    private final Map<String, Class<?>> typesByName = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> namesByType = new ConcurrentHashMap<>();
    private final Map<String, Optional<Class<?>>> loaded = new ConcurrentHashMap<>();

    public EventTypeRegistry register(Class<?> type) {
        return register(type.getName(), type);
    }

    public EventTypeRegistry register(String name, Class<?> type) {
        Objects.requireNonNull(name, "Event type name cannot be null");
        Objects.requireNonNull(type, "Event type cannot be null");
        Class<?> existing = typesByName.putIfAbsent(name, type);
        if (existing != null && !existing.equals(type)) {
            throw new IllegalArgumentException("Event type name '" + name + "' is already registered for "
                    + existing.getName());
        }
        namesByType.put(type, name);
        return this;
    }

    public String nameOf(Class<?> type) {
        return namesByType.getOrDefault(type, type.getName());
    }

    public Optional<Class<?>> resolve(String name) {
        Class<?> registered = typesByName.get(name);
        if (registered != null) {
            return Optional.of(registered);
        }
        return loaded.computeIfAbsent(name, this::load);
    }

    private Optional<Class<?>> load(String name) {
        try {
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            if (classLoader == null) {
                classLoader = EventTypeRegistry.class.getClassLoader();
            }
            return Optional.of(Class.forName(name, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            logger.debug("No class found for event type '{}'", name);
            return Optional.empty();
        }
    }
}
