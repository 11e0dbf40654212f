package com.nayem.revision.metadata;

import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link EntityDescriptor} derived from {@link PrimaryKey} and
 * {@link Relationship} field annotations.
 * <p>
 * Fields of superclasses are included. Building a descriptor scans the class
 * once; {@link EntityDescriptorRegistry} caches the result per type.
 * </p>
 *
 * @param <T> The entity type
 */
public class AnnotatedEntityDescriptor<T> implements EntityDescriptor<T> {

    private final Class<T> entityType;
    private final List<Field> primaryKeyFields;
    private final List<String> primaryKeyAttributes;
    private final Set<String> collectionAttributes;

    private AnnotatedEntityDescriptor(Class<T> entityType, List<Field> primaryKeyFields,
            Set<String> collectionAttributes) {
        this.entityType = entityType;
        this.primaryKeyFields = primaryKeyFields;
        this.primaryKeyAttributes = primaryKeyFields.stream().map(Field::getName).toList();
        this.collectionAttributes = collectionAttributes;
    }

    /**
     * Scans the annotations of the given type.
     *
     * @throws IllegalArgumentException if no field is annotated with
     *                                  {@link PrimaryKey}
     */
    public static <T> AnnotatedEntityDescriptor<T> of(Class<T> entityType) {
        List<Field> keyFields = new ArrayList<>();
        Set<String> collections = new HashSet<>();

        ReflectionUtils.doWithFields(entityType, field -> {
            if (field.isAnnotationPresent(PrimaryKey.class)) {
                ReflectionUtils.makeAccessible(field);
                keyFields.add(field);
            }
            Relationship relationship = field.getAnnotation(Relationship.class);
            if (relationship != null && relationship.value().isCollection()) {
                collections.add(field.getName());
            }
        }, field -> !Modifier.isStatic(field.getModifiers()));

        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException(
                    "No @PrimaryKey field found on " + entityType.getName());
        }

        // Stable sort: equal orders keep declaration order
        keyFields.sort(Comparator.comparingInt(field -> field.getAnnotation(PrimaryKey.class).order()));
        return new AnnotatedEntityDescriptor<>(entityType, List.copyOf(keyFields), Set.copyOf(collections));
    }

    /**
     * Whether the type declares at least one {@link PrimaryKey} field.
     */
    public static boolean isAnnotated(Class<?> type) {
        Class<?> current = type;
        while (current != null && current != Object.class) {
            for (Field field : current.getDeclaredFields()) {
                if (field.isAnnotationPresent(PrimaryKey.class)) {
                    return true;
                }
            }
            current = current.getSuperclass();
        }
        return false;
    }

    @Override
    public Class<T> getEntityType() {
        return entityType;
    }

    @Override
    public List<String> getPrimaryKeyAttributes() {
        return primaryKeyAttributes;
    }

    @Override
    public List<Object> primaryKeyOf(T entity) {
        List<Object> values = new ArrayList<>(primaryKeyFields.size());
        for (Field field : primaryKeyFields) {
            values.add(ReflectionUtils.getField(field, entity));
        }
        return values;
    }

    @Override
    public boolean isCollectionRelationship(String attribute) {
        return collectionAttributes.contains(attribute);
    }
}
