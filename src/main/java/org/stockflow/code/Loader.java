/*
 * Copyright 2025 The Stockflow Authors
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

package org.stockflow.code;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * A Loader implements the low-level operation of creating new MethodHandles from the bytecode for
 * some static methods, all defined in a single new hidden class. The lifecycle of a Loader is
 *
 * <ul>
 *   <li>Create a new Loader using {@link #newLoader}.
 *   <li>Call {@link #initialize} on it.
 *   <li>For each method, call {@link #startMethod} and write the method body to the result of
 *       {@link #methodVisitor()}, using {@link #emitLoadConstant} to reference existing objects.
 *   <li>Call {@link #load} to define the class and to populate a {@link DebugInfo} with
 *       information useful for debugging any exceptions that might be thrown by the generated code.
 *   <li>Call {@link #findMethod} to get a MethodHandle for each method.
 * </ul>
 */
public final class Loader {

  private ClassWriter classWriter;
  private MethodVisitor methodVisitor;
  private Lookup lookup;
  private Lookup newLookup;

  /**
   * We use CONSTANT_Dynamic entries in the constant pool to implement {@link #emitLoadConstant},
   * which requires a bootstrap method to provide its value (see the package docs for {@code
   * java.lang.invoke} for details). Fortunately {@link MethodHandles#classDataAt} is designed to
   * serve this purpose, so we just need to construct an ASM Handle for it.
   */
  private static final Handle CLASS_DATA_AT =
      new Handle(
          Opcodes.H_INVOKESTATIC,
          asmType(MethodHandles.class),
          "classDataAt",
          MethodType.methodType(Object.class, Lookup.class, String.class, Class.class, int.class)
              .toMethodDescriptorString(),
          false);

  /** Chars that can't appear in a JVM class name, or that we'd rather not see in stack traces. */
  private static final CharMatcher NOT_CLASS_NAME_CHAR =
      CharMatcher.javaLetterOrDigit().or(CharMatcher.is('_')).negate();

  /** The ConstantDynamic created for an object passed to {@link #emitLoadConstant}. */
  private static class ConstantEntry {
    final ConstantDynamic cd;
    final Class<?> type;

    ConstantEntry(ConstantDynamic cd, Class<?> type) {
      this.cd = cd;
      this.type = type;
    }
  }

  /**
   * Maps each object that has been passed to {@link #emitLoadConstant} to the ConstantDynamic that
   * we created for it and the associated type.
   */
  private final IdentityHashMap<Object, ConstantEntry> constants = new IdentityHashMap<>();

  /** Information about a loaded class that may be useful when debugging the generated code. */
  public static class DebugInfo {
    /** The class file, as passed to the JVM. */
    public byte[] classBytes;

    /** The objects referenced by the class's constant pool, in index order. */
    public Object[] constants;

    @Override
    public String toString() {
      return String.format(
          "%s bytes, %s constants",
          (classBytes == null) ? 0 : classBytes.length,
          (constants == null) ? 0 : constants.length);
    }
  }

  /** Returns the JVM class file version that will be used by this Loader. */
  public int classFileVersion() {
    return Opcodes.V17;
  }

  /**
   * Writes an instruction to {@link #methodVisitor()} to push the given object on the stack, as an
   * instance of the given type.
   *
   * <p>Only intended for objects that are not supported directly by the Java constant pool; strings
   * and numbers should be pushed with the appropriate methods on {@link #methodVisitor()}.
   */
  public void emitLoadConstant(Object x, Class<?> type) {
    ConstantEntry entry = constants.get(x);
    if (entry == null) {
      // Create a new CONSTANT_Dynamic that will be initialized by calling classDataAt() with the
      // next available index.
      ConstantDynamic cd =
          new ConstantDynamic(
              "_", org.objectweb.asm.Type.getDescriptor(type), CLASS_DATA_AT, constants.size());
      entry = new ConstantEntry(cd, type);
      constants.put(x, entry);
    }
    methodVisitor().visitLdcInsn(entry.cd);
    // If we created this constant with a weaker type and we're now trying to use it with a stronger
    // type we'll need to throw in a cast to make the verifier happy.
    if (!type.isAssignableFrom(entry.type)) {
      methodVisitor().visitTypeInsn(Opcodes.CHECKCAST, asmType(type));
    }
  }

  /**
   * Should be called after all method bodies have been written; defines the new class. The given
   * DebugInfo will be populated with various bits of information that might be useful for
   * understanding or debugging the generated code.
   */
  public void load(DebugInfo debugInfo) {
    Preconditions.checkState(newLookup == null, "already loaded");
    byte[] bytes = classWriterToBytes(debugInfo);
    Object[] constArray = new Object[constants.size()];
    debugInfo.constants = constArray;
    for (Map.Entry<Object, ConstantEntry> entry : constants.entrySet()) {
      constArray[(int) entry.getValue().cd.getBootstrapMethodArgument(0)] = entry.getKey();
    }
    @SuppressWarnings("JdkImmutableCollections")
    Object classData = List.of(constArray);
    try {
      newLookup = lookup.defineHiddenClassWithClassData(bytes, classData, /* initialize= */ true);
    } catch (Throwable e) {
      throw new IllegalArgumentException(e);
    }
  }

  /** Creates a Loader. */
  public static Loader newLoader() {
    return new Loader();
  }

  /**
   * Prepares a newly-created loader to start constructing method bodies. The new class will be
   * defined in the package of the {@code lookup} argument; it is not accessible by name, and
   * multiple Loaders can use the same {@code className} without conflicting.
   *
   * @param className will appear in any stack traces thrown while executing the constructed
   *     methods; chars that aren't valid in a Java identifier are replaced by underscores
   * @param lookup a {@link MethodHandles.Lookup} for the package in which the generated class will
   *     be loaded, and which it will have access to
   * @param sourceFileName if non-null, will appear in any stack traces thrown while executing the
   *     constructed methods
   */
  public void initialize(String className, Lookup lookup, String sourceFileName) {
    Preconditions.checkState(classWriter == null);
    this.lookup = lookup;
    String internalName =
        lookup.lookupClass().getPackageName().replace('.', '/')
            + "/"
            + NOT_CLASS_NAME_CHAR.replaceFrom(className, '_');
    // We only ever merge frames whose stacks hold doubles, so the ClassWriter never needs to load
    // a class to compute a common superclass.
    classWriter = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    classWriter.visit(
        classFileVersion(),
        Opcodes.ACC_FINAL + Opcodes.ACC_SUPER + Opcodes.ACC_PUBLIC,
        internalName,
        null,
        "java/lang/Object",
        null);
    if (sourceFileName != null) {
      classWriter.visitSource(sourceFileName, null);
    }
  }

  /**
   * Starts a new static, public method with the given name and signature; its body should be
   * written to {@link #methodVisitor()}.
   */
  public void startMethod(String methodName, MethodType methodType) {
    Preconditions.checkState(classWriter != null && newLookup == null);
    endMethod();
    methodVisitor =
        classWriter.visitMethod(
            Opcodes.ACC_STATIC + Opcodes.ACC_PUBLIC,
            methodName,
            methodType.toMethodDescriptorString(),
            null,
            null);
    methodVisitor.visitCode();
  }

  private void endMethod() {
    if (methodVisitor != null) {
      // Sizes are computed by the ClassWriter.
      methodVisitor.visitMaxs(0, 0);
      methodVisitor.visitEnd();
      methodVisitor = null;
    }
  }

  /** Returns the string used by the JVM to identify the given class. */
  static String asmType(Class<?> type) {
    return org.objectweb.asm.Type.getInternalName(type);
  }

  /**
   * Returns the {@link MethodVisitor} that should be used to write the current method's body. Only
   * valid after calling {@link #startMethod}.
   */
  MethodVisitor methodVisitor() {
    return methodVisitor;
  }

  /**
   * Returns the JVM byte encoding of the class to be loaded. Also saves those bytes in {@code
   * debugInfo}.
   */
  private byte[] classWriterToBytes(DebugInfo debugInfo) {
    endMethod();
    classWriter.visitEnd();
    byte[] bytes = classWriter.toByteArray();
    debugInfo.classBytes = bytes;
    return bytes;
  }

  /** Returns a MethodHandle for one of the methods of the newly-loaded class. */
  public MethodHandle findMethod(String methodName, MethodType methodType) {
    Preconditions.checkState(newLookup != null, "not loaded");
    try {
      return newLookup.findStatic(newLookup.lookupClass(), methodName, methodType);
    } catch (ReflectiveOperationException e) {
      throw new AssertionError(e);
    }
  }
}
