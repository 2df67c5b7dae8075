/*
 * Copyright 2024 The Closure Compiler Authors.
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

package com.google.jsonnet.ast;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/**
 * A member of an {@link ObjectLiteral} or {@link ObjectComp} as written in source.
 *
 * <p>The fodder slots are shared between member kinds the same way the grammar shares tokens:
 *
 * <ul>
 *   <li>{@code fodder1} precedes {@code local}, the field identifier, {@code [} or {@code assert}.
 *   <li>{@code fodder2} precedes the identifier of a local, or {@code ]} of a computed name.
 *   <li>{@code opFodder} precedes {@code =}, the visibility marker, or the {@code :} of an assert.
 *   <li>{@code commaFodder} precedes the comma after the member.
 * </ul>
 */
public final class ObjectField {

  /** The syntactic form of an object member. */
  public enum Kind {
    /** {@code local x = e} */
    LOCAL,
    /** {@code x: e} */
    FIELD_ID,
    /** {@code "x": e} */
    FIELD_STR,
    /** {@code [e1]: e2} */
    FIELD_EXPR,
    /** {@code assert e1 : e2} */
    ASSERT
  }

  private final Kind kind;
  private final Visibility visibility;
  private final boolean superSugar;
  private final @Nullable ParameterList params;
  private final Fodder fodder1;
  private final Fodder fodder2;
  private final Fodder opFodder;
  private final Fodder commaFodder;
  private final @Nullable String id;
  private final @Nullable Node nameExpr;
  private final Node body;
  private final @Nullable Node message;
  private final @Nullable LocationRange location;

  private ObjectField(
      Kind kind,
      Visibility visibility,
      boolean superSugar,
      @Nullable ParameterList params,
      Fodder fodder1,
      Fodder fodder2,
      Fodder opFodder,
      Fodder commaFodder,
      @Nullable String id,
      @Nullable Node nameExpr,
      Node body,
      @Nullable Node message,
      @Nullable LocationRange location) {
    this.kind = kind;
    this.visibility = checkNotNull(visibility);
    this.superSugar = superSugar;
    this.params = params;
    this.fodder1 = checkNotNull(fodder1);
    this.fodder2 = checkNotNull(fodder2);
    this.opFodder = checkNotNull(opFodder);
    this.commaFodder = checkNotNull(commaFodder);
    this.id = id;
    this.nameExpr = nameExpr;
    this.body = checkNotNull(body);
    this.message = message;
    this.location = location;
  }

  public static ObjectField local(
      Fodder localFodder,
      Fodder idFodder,
      String id,
      @Nullable ParameterList params,
      Fodder eqFodder,
      Node body,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    return new ObjectField(
        Kind.LOCAL, Visibility.INHERIT, false, params, localFodder, idFodder, eqFodder,
        commaFodder, checkNotNull(id), null, body, null, location);
  }

  public static ObjectField withId(
      Fodder idFodder,
      String id,
      @Nullable ParameterList params,
      Fodder opFodder,
      boolean superSugar,
      Visibility visibility,
      Node body,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    return new ObjectField(
        Kind.FIELD_ID, visibility, superSugar, params, idFodder, Fodder.EMPTY, opFodder,
        commaFodder, checkNotNull(id), null, body, null, location);
  }

  public static ObjectField withString(
      LiteralString name,
      @Nullable ParameterList params,
      Fodder opFodder,
      boolean superSugar,
      Visibility visibility,
      Node body,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    return new ObjectField(
        Kind.FIELD_STR, visibility, superSugar, params, Fodder.EMPTY, Fodder.EMPTY, opFodder,
        commaFodder, null, checkNotNull(name), body, null, location);
  }

  public static ObjectField withExpr(
      Fodder leftBracketFodder,
      Node nameExpr,
      Fodder rightBracketFodder,
      @Nullable ParameterList params,
      Fodder opFodder,
      boolean superSugar,
      Visibility visibility,
      Node body,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    return new ObjectField(
        Kind.FIELD_EXPR, visibility, superSugar, params, leftBracketFodder, rightBracketFodder,
        opFodder, commaFodder, null, checkNotNull(nameExpr), body, null, location);
  }

  public static ObjectField assertion(
      Fodder assertFodder,
      Node condition,
      Fodder colonFodder,
      @Nullable Node message,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    return new ObjectField(
        Kind.ASSERT, Visibility.INHERIT, false, null, assertFodder, Fodder.EMPTY, colonFodder,
        commaFodder, null, null, condition, message, location);
  }

  public Kind getKind() {
    return kind;
  }

  public Visibility getVisibility() {
    return visibility;
  }

  /** Whether the field was written {@code x+: e}. */
  public boolean isSuperSugar() {
    return superSugar;
  }

  /** Parameters of a method-sugared field or local, otherwise null. */
  public @Nullable ParameterList getParams() {
    return params;
  }

  public Fodder getFodder1() {
    return fodder1;
  }

  public Fodder getFodder2() {
    return fodder2;
  }

  public Fodder getOpFodder() {
    return opFodder;
  }

  public Fodder getCommaFodder() {
    return commaFodder;
  }

  /** The identifier of a {@link Kind#LOCAL} or {@link Kind#FIELD_ID} member. */
  public @Nullable String getId() {
    return id;
  }

  /** The name of a {@link Kind#FIELD_STR} or {@link Kind#FIELD_EXPR} member. */
  public @Nullable Node getNameExpr() {
    return nameExpr;
  }

  /** The value of a field or local. */
  public Node getBody() {
    checkState(kind != Kind.ASSERT, "assert members have a condition, not a body");
    return body;
  }

  public Node getCondition() {
    checkState(kind == Kind.ASSERT, "only assert members have a condition");
    return body;
  }

  /** The message of an assert member, if any. */
  public @Nullable Node getMessage() {
    return message;
  }

  public @Nullable LocationRange getLocation() {
    return location;
  }

  /** Returns a copy of this member with its expressions replaced. */
  public ObjectField withExprs(
      @Nullable ParameterList newParams,
      @Nullable Node newNameExpr,
      Node newBody,
      @Nullable Node newMessage) {
    return new ObjectField(
        kind, visibility, superSugar, newParams, fodder1, fodder2, opFodder, commaFodder, id,
        newNameExpr, newBody, newMessage, location);
  }
}
