package io.ircd.ext;

final class TestEntity extends Extensible {
  private final EntityKind kind;
  private final String id;

  TestEntity(EntityKind kind, String id) {
    this.kind = kind;
    this.id = id;
  }

  static TestEntity user(String id) {
    return new TestEntity(EntityKind.USER, id);
  }

  @Override
  public EntityKind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return "TestEntity{" + id + "}";
  }
}
