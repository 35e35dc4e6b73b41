/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.pathtrace.report.serialize;

import com.dslplatform.json.BoolConverter;
import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonWriter;
import com.dslplatform.json.NumberConverter;
import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.ErrorInfo;
import io.pathtrace.impl.tracer.KeyValuePair;
import io.pathtrace.impl.tracer.LinkKind;
import io.pathtrace.impl.tracer.TracerLink;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

import static com.dslplatform.json.JsonWriter.ARRAY_END;
import static com.dslplatform.json.JsonWriter.ARRAY_START;
import static com.dslplatform.json.JsonWriter.COMMA;
import static com.dslplatform.json.JsonWriter.OBJECT_END;
import static com.dslplatform.json.JsonWriter.OBJECT_START;

/**
 * Renders completed paths as JSON.
 * <p>
 * {@link LinkKind#CHILD} children are nested.
 * {@link LinkKind#TAG_LINKED} children are rendered as a reference to their id,
 * as they are serialized as part of their own path.
 * </p>
 * <p>
 * Not thread safe, each thread should use its own instance.
 * </p>
 */
public class PathJsonSerializer {

    static final int BUFFER_SIZE = 16384;
    static final int MAX_VALUE_LENGTH = 1024;
    private static final byte NEW_LINE = (byte) '\n';

    // visible for testing
    final JsonWriter jw;
    private final StringBuilder replaceBuilder = new StringBuilder(MAX_VALUE_LENGTH);

    public PathJsonSerializer() {
        jw = new DslJson<>().newWriter(BUFFER_SIZE);
    }

    /**
     * Writes one line of JSON per path.
     */
    public void serializePaths(List<AbstractTracer> roots, OutputStream os) throws IOException {
        jw.reset(os);
        for (AbstractTracer root : roots) {
            serializeTracer(root);
            jw.writeByte(NEW_LINE);
        }
        jw.flush();
        jw.reset();
    }

    public String toJsonString(AbstractTracer tracer) {
        jw.reset();
        serializeTracer(tracer);
        final String s = jw.toString();
        jw.reset();
        return s;
    }

    public String toJsonString(List<AbstractTracer> roots) {
        jw.reset();
        jw.writeByte(ARRAY_START);
        for (int i = 0; i < roots.size(); i++) {
            if (i > 0) {
                jw.writeByte(COMMA);
            }
            serializeTracer(roots.get(i));
        }
        jw.writeByte(ARRAY_END);
        final String s = jw.toString();
        jw.reset();
        return s;
    }

    private void serializeTracer(AbstractTracer tracer) {
        jw.writeByte(OBJECT_START);
        writeField("id", tracer.getId());
        writeField("kind", tracer.getKind().getDisplayName());
        writeField("state", tracer.getState().name());
        writeField("thread", tracer.getOwnerThreadName());
        serializeValues(tracer.getValues());
        serializeError(tracer.getErrorInfo());
        serializeIncomingTag(tracer);
        serializeCustomAttributes(tracer.getCustomAttributes());
        serializeChildren(tracer.getChildren());
        jw.writeByte(OBJECT_END);
    }

    private void serializeValues(Map<String, Object> values) {
        if (values.isEmpty()) {
            return;
        }
        writeFieldName("values");
        jw.writeByte(OBJECT_START);
        boolean first = true;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!first) {
                jw.writeByte(COMMA);
            }
            first = false;
            writeFieldName(entry.getKey());
            writeValue(entry.getValue());
        }
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
    }

    private void writeValue(@Nullable Object value) {
        if (value == null) {
            jw.writeNull();
        } else if (value instanceof Integer || value instanceof Long) {
            NumberConverter.serialize(((Number) value).longValue(), jw);
        } else if (value instanceof Number) {
            NumberConverter.serialize(((Number) value).doubleValue(), jw);
        } else if (value instanceof Boolean) {
            BoolConverter.serialize((Boolean) value, jw);
        } else if (value instanceof List) {
            writeKeyValuePairs((List<?>) value);
        } else {
            writeStringValue(value.toString());
        }
    }

    private void writeKeyValuePairs(List<?> pairs) {
        jw.writeByte(ARRAY_START);
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) {
                jw.writeByte(COMMA);
            }
            final Object element = pairs.get(i);
            if (element instanceof KeyValuePair) {
                final KeyValuePair pair = (KeyValuePair) element;
                jw.writeByte(OBJECT_START);
                writeField("key", pair.getKey());
                writeLastField("value", pair.getValue());
                jw.writeByte(OBJECT_END);
            } else {
                writeValue(element);
            }
        }
        jw.writeByte(ARRAY_END);
    }

    private void serializeError(@Nullable ErrorInfo errorInfo) {
        if (errorInfo == null) {
            return;
        }
        writeFieldName("error");
        jw.writeByte(OBJECT_START);
        writeField("class", errorInfo.getErrorClass());
        writeLastField("message", errorInfo.getMessage());
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
    }

    private void serializeIncomingTag(AbstractTracer tracer) {
        final TracerId incomingTagId = tracer.getIncomingTagId();
        if (incomingTagId == null) {
            return;
        }
        writeFieldName("incoming_tag");
        jw.writeByte(OBJECT_START);
        writeField("id", incomingTagId);
        writeLastField("resolved", tracer.isIncomingTagResolved());
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
    }

    private void serializeCustomAttributes(Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return;
        }
        writeFieldName("custom_attributes");
        jw.writeByte(OBJECT_START);
        boolean first = true;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            if (!first) {
                jw.writeByte(COMMA);
            }
            first = false;
            // user supplied keys may need escaping
            jw.writeString(entry.getKey());
            jw.writeByte(JsonWriter.SEMI);
            writeValue(entry.getValue());
        }
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
    }

    private void serializeChildren(List<TracerLink> children) {
        writeFieldName("children");
        jw.writeByte(ARRAY_START);
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                jw.writeByte(COMMA);
            }
            final TracerLink link = children.get(i);
            jw.writeByte(OBJECT_START);
            writeField("link", link.getKind().name());
            if (link.getKind() == LinkKind.CHILD) {
                writeFieldName("tracer");
                serializeTracer(link.getTracer());
            } else {
                writeFieldName("id");
                writeStringValue(link.getTracer().getId().toHexString());
            }
            jw.writeByte(OBJECT_END);
        }
        jw.writeByte(ARRAY_END);
    }

    private void writeField(final String fieldName, final TracerId id) {
        writeFieldName(fieldName);
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeAscii(id.toHexString());
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeByte(COMMA);
    }

    void writeField(final String fieldName, @Nullable final String value) {
        if (value != null) {
            writeFieldName(fieldName);
            writeStringValue(value);
            jw.writeByte(COMMA);
        }
    }

    void writeLastField(final String fieldName, @Nullable final String value) {
        writeFieldName(fieldName);
        if (value != null) {
            writeStringValue(value);
        } else {
            jw.writeNull();
        }
    }

    private void writeLastField(final String fieldName, final boolean value) {
        writeFieldName(fieldName);
        BoolConverter.serialize(value, jw);
    }

    private void writeStringValue(String value) {
        if (value.length() > MAX_VALUE_LENGTH) {
            replaceBuilder.setLength(0);
            replaceBuilder.append(value, 0, MAX_VALUE_LENGTH - 1);
            replaceBuilder.append('…');
            jw.writeString(replaceBuilder);
        } else {
            jw.writeString(value);
        }
    }

    private void writeFieldName(final String fieldName) {
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeAscii(fieldName);
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeByte(JsonWriter.SEMI);
    }
}
