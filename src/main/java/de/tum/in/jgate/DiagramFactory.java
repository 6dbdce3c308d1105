/*
 * This file is part of JGate.
 * Copyright (c) 2026 The JGate Authors.
 *
 * JGate is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JGate is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JGate. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jgate;

public final class DiagramFactory {
    private DiagramFactory() {}

    public static DecisionDiagram buildDiagram() {
        return buildDiagram(ImmutableDiagramConfiguration.builder().build());
    }

    public static DecisionDiagram buildDiagram(DiagramConfiguration configuration) {
        return new DecisionDiagramImpl(configuration);
    }
}
