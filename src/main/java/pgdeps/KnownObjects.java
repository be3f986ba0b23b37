package pgdeps;

import java.util.HashMap;
import java.util.Map;
import pgdeps.models.ObjectKind;
import pgdeps.models.SchemaObject;

/**
 * Objects a gateway has already read from the catalog, so that the object being inspected can
 * be described without another round trip. Unknown objects are described as {@link ObjectKind#OTHER}.
 */
class KnownObjects
{
  private final Map<SchemaObject, SchemaObject> objects = new HashMap<>();

  SchemaObject remember(SchemaObject obj)
  {
    objects.putIfAbsent(obj, obj);
    return obj;
  }

  SchemaObject resolve(String schema, String name)
  {
    SchemaObject ref = new SchemaObject(schema, name, ObjectKind.OTHER);
    return objects.getOrDefault(ref, ref);
  }
}
