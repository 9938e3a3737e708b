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

package org.lispic.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IdentTest {

  @Test
  public void extend() {
    Ident root = Ident.empty();
    assertThat(root.isEmpty()).isTrue();
    assertThat(root.toString()).isEmpty();
    Ident f = root.extend("f");
    Ident x = f.extend("x");
    assertThat(x.segments()).containsExactly("f", "x").inOrder();
    assertThat(x.name()).isEqualTo("x");
    assertThat(x.toString()).isEqualTo("f::x");
    // extend() doesn't modify the original
    assertThat(f.toString()).isEqualTo("f");
    assertThat(root.isEmpty()).isTrue();
  }

  @Test
  public void equality() {
    Ident a = Ident.empty().extend("{let 0}").extend("x");
    assertThat(a).isEqualTo(Ident.parse("{let 0}::x"));
    assertThat(a.hashCode()).isEqualTo(Ident.parse("{let 0}::x").hashCode());
    assertThat(a).isNotEqualTo(Ident.parse("{let 1}::x"));
    assertThat(a).isNotEqualTo(Ident.of("x"));
    // A top-level name is the same as an unresolved reference to it
    assertThat(Ident.empty().extend("pi")).isEqualTo(Ident.of("pi"));
  }

  @Test
  public void badSegments() {
    assertThrows(IllegalArgumentException.class, () -> Ident.of(""));
    assertThrows(IllegalArgumentException.class, () -> Ident.parse(""));
    assertThrows(IllegalStateException.class, () -> Ident.empty().name());
  }
}
