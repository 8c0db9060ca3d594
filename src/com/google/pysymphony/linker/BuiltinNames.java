/*
 * Copyright 2026 The PySymphony Authors.
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

package com.google.pysymphony.linker;

import com.google.common.collect.ImmutableSet;

/**
 * The fixed registry of names that resolve without a definition: the builtins module, the
 * attributes every module namespace has and the implicit names of class bodies and methods.
 * References to these names never produce a dependency or an undefined-reference diagnostic.
 */
public final class BuiltinNames {

  private static final ImmutableSet<String> NAMES =
      ImmutableSet.of(
          // Functions and types
          "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint",
          "bytearray", "bytes", "callable", "chr", "classmethod", "compile", "complex",
          "copyright", "credits", "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec",
          "exit", "filter", "float", "format", "frozenset", "getattr", "globals", "hasattr",
          "hash", "help", "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len",
          "license", "list", "locals", "map", "max", "memoryview", "min", "next", "object", "oct",
          "open", "ord", "pow", "print", "property", "quit", "range", "repr", "reversed", "round",
          "set", "setattr", "slice", "sorted", "staticmethod", "str", "sum", "super", "tuple",
          "type", "vars", "zip", "__import__", "__build_class__", "__debug__", "NotImplemented",
          "Ellipsis",
          // Exceptions and warnings
          "ArithmeticError", "AssertionError", "AttributeError", "BaseException",
          "BaseExceptionGroup", "BlockingIOError", "BrokenPipeError", "BufferError",
          "BytesWarning", "ChildProcessError", "ConnectionAbortedError", "ConnectionError",
          "ConnectionRefusedError", "ConnectionResetError", "DeprecationWarning", "EOFError",
          "EncodingWarning", "EnvironmentError", "Exception", "ExceptionGroup", "FileExistsError",
          "FileNotFoundError", "FloatingPointError", "FutureWarning", "GeneratorExit", "IOError",
          "ImportError", "ImportWarning", "IndentationError", "IndexError", "InterruptedError",
          "IsADirectoryError", "KeyError", "KeyboardInterrupt", "LookupError", "MemoryError",
          "ModuleNotFoundError", "NameError", "NotADirectoryError", "NotImplementedError",
          "OSError", "OverflowError", "PendingDeprecationWarning", "PermissionError",
          "ProcessLookupError", "RecursionError", "ReferenceError", "ResourceWarning",
          "RuntimeError", "RuntimeWarning", "StopAsyncIteration", "StopIteration", "SyntaxError",
          "SyntaxWarning", "SystemError", "SystemExit", "TabError", "TimeoutError", "TypeError",
          "UnboundLocalError", "UnicodeDecodeError", "UnicodeEncodeError", "UnicodeError",
          "UnicodeTranslateError", "UnicodeWarning", "UserWarning", "ValueError", "Warning",
          "ZeroDivisionError", "WindowsError",
          // Module attributes
          "__name__", "__file__", "__doc__", "__package__", "__spec__", "__loader__",
          "__builtins__", "__annotations__", "__path__", "__cached__", "__dict__",
          // Class bodies and methods
          "__class__", "__qualname__", "__module__");

  private BuiltinNames() {}

  public static boolean isBuiltin(String name) {
    return NAMES.contains(name);
  }

  public static ImmutableSet<String> names() {
    return NAMES;
  }
}
