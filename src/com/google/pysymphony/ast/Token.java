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

package com.google.pysymphony.ast;

/**
 * The closed set of syntax tree node kinds.
 *
 * <p>The child layout of each kind is documented next to it. Optional children that are absent
 * are represented by an {@link #EMPTY} node so that positional access stays stable.
 */
public enum Token {
  /** Statements of a source file. */
  MODULE,
  /** Statements of a block. */
  SUITE,

  /** String: name. Children: DECORATORS, PARAM_LIST, return annotation or EMPTY, SUITE. */
  FUNCTION_DEF,
  /** String: name. Children: DECORATORS, ARG_LIST (bases and keywords), SUITE. */
  CLASS_DEF,
  DECORATORS,
  PARAM_LIST,
  /**
   * String: name, null for a bare {@code *} or the {@code /} marker. Children: annotation or
   * EMPTY, default or EMPTY.
   */
  PARAM,
  ARG_LIST,

  /** Children: test, SUITE, optional else (SUITE or an IF with the ELIF prop). */
  IF,
  /** Children: test, SUITE, optional else SUITE. */
  WHILE,
  /** Children: target, iterable, SUITE, optional else SUITE. */
  FOR,
  /** Children: SUITE, EXCEPT*, optional TRY_ELSE, optional FINALLY. */
  TRY,
  /** String: bound name or null. Children: type or EMPTY, SUITE. */
  EXCEPT,
  /** Children: SUITE. */
  TRY_ELSE,
  /** Children: SUITE. */
  FINALLY,
  /** Children: WITH_ITEM+, SUITE. */
  WITH,
  /** Children: context expression, target or EMPTY. */
  WITH_ITEM,

  RETURN,
  PASS,
  BREAK,
  CONTINUE,
  /** Children: exception or EMPTY, cause or EMPTY. */
  RAISE,
  ASSERT,
  DEL,
  /** Children: IDENTIFIER+. */
  GLOBAL,
  /** Children: IDENTIFIER+. */
  NONLOCAL,
  IDENTIFIER,

  EXPR_STMT,
  /** Children: target+, value. */
  ASSIGN,
  /** String: operator, such as {@code +=}. Children: target, value. */
  AUG_ASSIGN,
  /** Children: target, annotation, value or EMPTY. */
  ANN_ASSIGN,

  /** Children: IMPORT_ALIAS+. */
  IMPORT,
  /** String: module name, possibly empty. Int prop: relative level. Children: IMPORT_ALIAS+. */
  IMPORT_FROM,
  /** String: imported (possibly dotted) name or {@code *}. Alias: the {@code as} name. */
  IMPORT_ALIAS,

  NAME,
  /** String: attribute name. Children: object. */
  GETATTR,
  /** Children: object, index. */
  SUBSCRIPT,
  /** Children: lower or EMPTY, upper or EMPTY, step or EMPTY. */
  SLICE,
  /** Children: callee, arguments. */
  CALL,
  /** String: keyword. Children: value. */
  KEYWORD_ARG,
  STAR_ARG,
  DOUBLE_STAR_ARG,

  /** String: operator. */
  BINOP,
  /** String: operator. */
  UNARYOP,
  /** String: {@code and} or {@code or}. */
  BOOLOP,
  /** Children: operand, (COMPARE_OP, operand)+. */
  COMPARE,
  COMPARE_OP,
  /** Children: body, test, orelse. */
  IFEXP,
  /** Children: PARAM_LIST, body. */
  LAMBDA,
  /** Children: target NAME, value. */
  NAMED_EXPR,
  AWAIT,
  /** Children: value or nothing. */
  YIELD,
  YIELD_FROM,
  STARRED,

  TUPLE,
  LIST,
  SET,
  /** Children: DICT_ENTRY or DOUBLE_STAR_ARG. */
  DICT,
  /** Children: key, value. */
  DICT_ENTRY,

  /** Children: element, COMP_FOR+. */
  LIST_COMP,
  SET_COMP,
  /** Children: DICT_ENTRY, COMP_FOR+. */
  DICT_COMP,
  GENERATOR_EXP,
  /** Children: target, iterable, condition*. */
  COMP_FOR,

  /** String: literal text. */
  NUMBER,
  /** String: literal text including prefix and quotes. */
  STRING,
  /** Children: STRING or FSTRING parts written next to each other. */
  STRING_CONCAT,
  /** String: prefix and opening quote. Children: FSTRING_TEXT and FSTRING_FIELD. */
  FSTRING,
  /** String: raw text. */
  FSTRING_TEXT,
  /** String: conversion and format spec suffix, raw. Children: expression. */
  FSTRING_FIELD,
  /** String: None, True or False. */
  CONSTANT,
  ELLIPSIS,

  EMPTY;

  /** Whether nodes of this kind open a comprehension scope. */
  public boolean isComprehension() {
    switch (this) {
      case LIST_COMP:
      case SET_COMP:
      case DICT_COMP:
      case GENERATOR_EXP:
        return true;
      default:
        return false;
    }
  }
}
