package io.github.goodees.factstore.json;

/*-
 * #%L
 * factstore
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.factstore.core.DecodeException;
import io.github.goodees.factstore.core.EncodedEvent;
import io.github.goodees.factstore.core.EventDecoder;
import io.github.goodees.factstore.core.EventEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event codec storing events as JSON, with the type tag kept separately from the payload.
 *
 * <p>Every event class is registered under a type tag, by default its {@linkplain #defaultTypeTag(Class) simple
 * name without prefix Immutable and suffix Event}. Decoding looks the tag up in the registry, so that an unknown
 * tag is reported as an error, rather than silently dropped. Registered classes may be abstract, when they are
 * annotated for Jackson to deserialize as concrete type, e. g. an Immutables value type with
 * {@code @JsonDeserialize(as = ImmutableTicketOpenedEvent.class)}.
 *
 * <p>Classes should be registered before the codec is used.
 *
 * @param <E> base type of events
 */
public class JsonEventCodec<E> implements EventDecoder<E>, EventEncoder<E> {
    private static final Logger logger = LoggerFactory.getLogger(JsonEventCodec.class);
    private static final String IMMUTABLE_PREFIX = "Immutable";
    private static final String EVENT_SUFFIX = "Event";

    private final Class<E> baseType;
    private final ObjectMapper mapper;
    private final Map<String, Class<? extends E>> classesByType = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> typesByClass = new ConcurrentHashMap<>();

    public JsonEventCodec(Class<E> baseType) {
        this(baseType, createMapper());
    }

    public JsonEventCodec(Class<E> baseType, ObjectMapper mapper) {
        this.baseType = baseType;
        this.mapper = mapper;
    }

    /**
     * Object mapper configured for event payloads: java.time and Optional support, ISO dates, ignoring properties
     * that were added in future versions of an event.
     * @return new object mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Default type tag of an event class. ImmutableTicketOpenedEvent as well as TicketOpenedEvent becomes
     * TicketOpened. A name consisting of the affixes only is kept whole.
     * @param eventClass the event class
     * @return the tag
     */
    public static String defaultTypeTag(Class<?> eventClass) {
        String name = eventClass.getSimpleName();
        int start = name.startsWith(IMMUTABLE_PREFIX) ? IMMUTABLE_PREFIX.length() : 0;
        int end = name.endsWith(EVENT_SUFFIX) ? name.length() - EVENT_SUFFIX.length() : name.length();
        return end > start ? name.substring(start, end) : name;
    }

    public JsonEventCodec<E> register(Class<? extends E> eventClass) {
        return register(defaultTypeTag(eventClass), eventClass);
    }

    /**
     * Register event class under explicit type tag.
     * @param type the tag
     * @param eventClass class to serialize and deserialize
     * @return this codec
     * @throws IllegalArgumentException when the tag is already taken by other class
     */
    public JsonEventCodec<E> register(String type, Class<? extends E> eventClass) {
        Class<? extends E> previous = classesByType.putIfAbsent(type, eventClass);
        if (previous != null && !previous.equals(eventClass)) {
            throw new IllegalArgumentException("Type " + type + " is already registered for " + previous.getName());
        }
        typesByClass.put(eventClass, type);
        logger.debug("Registered event type {} as {}", type, eventClass.getName());
        return this;
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(classesByType.keySet()));
    }

    @Override
    public E decode(String type, String payload) throws DecodeException {
        Class<? extends E> eventClass = classesByType.get(type);
        if (eventClass == null) {
            throw DecodeException.unknownType(type);
        }
        try {
            return baseType.cast(mapper.readValue(payload, eventClass));
        } catch (IOException | RuntimeException e) {
            throw DecodeException.malformed(type, e);
        }
    }

    @Override
    public EncodedEvent encode(E event) {
        String type = typeOf(event);
        try {
            return EncodedEvent.of(type, mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize event " + event, e);
        }
    }

    /**
     * Find the type tag of an event. Exact class is preferred, otherwise the first registered supertype is used, which
     * covers generated subclasses of registered abstract types.
     * @param event the event
     * @return the type tag
     * @throws IllegalArgumentException when event's class is not registered
     */
    public String typeOf(E event) {
        String type = typesByClass.get(event.getClass());
        if (type != null) {
            return type;
        }
        for (Map.Entry<Class<?>, String> entry : typesByClass.entrySet()) {
            if (entry.getKey().isInstance(event)) {
                typesByClass.putIfAbsent(event.getClass(), entry.getValue());
                return entry.getValue();
            }
        }
        throw new IllegalArgumentException("Event class " + event.getClass().getName() + " is not registered");
    }
}
