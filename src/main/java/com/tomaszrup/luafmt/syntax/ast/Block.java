////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.luafmt.syntax.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * An ordered sequence of statements, each with an optional trailing semicolon.
 */
public final class Block implements SyntaxNode {

	public static final class Item {
		private final Stmt stmt;
		private final Token semicolon;

		public Item(Stmt stmt, Token semicolon) {
			this.stmt = stmt;
			this.semicolon = semicolon;
		}

		public Stmt getStmt() {
			return stmt;
		}

		public Token getSemicolon() {
			return semicolon;
		}
	}

	private final List<Item> items;

	public Block(List<Item> items) {
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
	}

	public static Block empty() {
		return new Block(Collections.emptyList());
	}

	public List<Item> getItems() {
		return items;
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

	public List<Stmt> getStmts() {
		List<Stmt> stmts = new ArrayList<>(items.size());
		for (Item item : items) {
			stmts.add(item.getStmt());
		}
		return stmts;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		for (Item item : items) {
			Nodes.visit(visitor, item.getStmt(), item.getSemicolon());
		}
		visitor.exitNode(this);
	}

	@Override
	public Block mapTokens(UnaryOperator<Token> mapper) {
		List<Item> mapped = new ArrayList<>(items.size());
		for (Item item : items) {
			Stmt stmt = Nodes.map(item.getStmt(), mapper, Stmt::mapTokens);
			Token semicolon = Nodes.map(item.getSemicolon(), mapper);
			mapped.add(new Item(stmt, semicolon));
		}
		return new Block(mapped);
	}
}
