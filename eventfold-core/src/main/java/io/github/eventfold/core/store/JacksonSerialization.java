package io.github.eventfold.core.store;

/*-
 * #%L
 * eventfold
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

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON serialization of single class with Jackson.
 *
 * @param <T> serialized type
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;
    private final int payloadVersion;

    public JacksonSerialization(Class<T> type) {
        this(createMapper(), type, 1);
    }

    public JacksonSerialization(ObjectMapper mapper, Class<T> type, int payloadVersion) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
        this.payloadVersion = payloadVersion;
    }

    /**
     * Object mapper with support for java.time and Optional types.
     * @return new object mapper
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload) {
        if (payloadVersion != this.payloadVersion) {
            throw new IllegalArgumentException("Unsupported payload version " + payloadVersion + " of "
                    + type.getSimpleName());
        }
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot deserialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public T toSerializable(Object o) {
        return type.isInstance(o) ? type.cast(o) : null;
    }
}
