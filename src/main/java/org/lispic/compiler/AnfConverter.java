/*
 * Copyright 2025 The Lispic Authors
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

package org.lispic.compiler;

import com.google.common.collect.ImmutableList;
import org.lispic.core.Binding;
import org.lispic.core.Expr;
import org.lispic.core.Expr.ListExpr;
import org.lispic.core.Ident;

/**
 * Converts a call into <a href="https://en.wikipedia.org/wiki/A-normal_form">A-normal form</a>.
 *
 * <p>If any argument of a call {@code (f a b ...)} is not atomic, each such argument is bound to a
 * new local in a let wrapped around the call, e.g. {@code (f (+ 1 2) 7)} becomes {@code (let ((_0
 * (+ 1 2))) (f _0 7))}.
 *
 * <p>Only the given node is converted: the arguments moved into the let are not themselves
 * converted, and nothing other than a ListExpr is changed. Apply the conversion again to normalize
 * further.
 *
 * <p>The locals are named {@code _i} after the argument position, so they are <b>not</b> unique;
 * converting a call nested inside another converted call can reuse the same name.
 */
public final class AnfConverter {

  private AnfConverter() {}

  public static Expr<Ident> convert(Expr<Ident> expr) {
    if (!(expr instanceof ListExpr<Ident> list)) {
      return expr;
    }
    ImmutableList<Expr<Ident>> args = list.args();
    if (args.stream().allMatch(Expr::isAtomic)) {
      return expr;
    }
    ImmutableList.Builder<Binding<Ident>> bindings = ImmutableList.builder();
    ImmutableList.Builder<Expr<Ident>> call = ImmutableList.builder();
    call.add(list.head());
    for (int i = 0; i < args.size(); i++) {
      Expr<Ident> arg = args.get(i);
      if (arg.isAtomic()) {
        call.add(arg);
      } else {
        Ident local = localName(i);
        bindings.add(new Binding<>(local, arg));
        call.add(Expr.identifier(local));
      }
    }
    return Expr.let(bindings.build(), ImmutableList.of(Expr.list(call.build())));
  }

  /** Returns the name of the local that holds the argument at position {@code i}. */
  static Ident localName(int i) {
    return Ident.of("_" + i);
  }
}
