// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;


/**
 * Maps classes of {@link LocalObject} to the handlers for their transactions. Lookup
 * uses the most specific registered superclass of an object's class.
 */
public final class HandlerRegistry {
	private final Map<Class<?>,TransactionHandler<?>> handlers =
		new ConcurrentHashMap<>();

	// Resolved lookups, including misses. Cleared whenever registrations change.
	private final Map<Class<?>,Optional<TransactionHandler<?>>> lookup_cache =
		new ConcurrentHashMap<>();


	/**
	 * The process-wide registry used by objects created without an explicit one. It
	 * is created on first access and lives until the process exits.
	 */
	public static HandlerRegistry global() {
		return GlobalHolder.INSTANCE;
	}


	/**
	 * Register the handler for a class (and subclasses without their own handler).
	 * Replaces any handler previously registered for the class.
	 */
	public <T extends LocalObject> void register( @Nonnull Class<T> type,
		@Nonnull TransactionHandler<? super T> handler ) {

		handlers.put( requireNonNull( type ), requireNonNull( handler ) );
		lookup_cache.clear();
	}


	public void unregister( @Nonnull Class<? extends LocalObject> type ) {
		handlers.remove( type );
		lookup_cache.clear();
	}


	/**
	 * Find the handler for an object.
	 *
	 * @return		The handler or null if none is registered for the object's class
	 * 				or any of its superclasses.
	 */
	@SuppressWarnings( "unchecked" )
	@Nullable
	public <T extends LocalObject> TransactionHandler<? super T> lookup(
		@Nonnull T object ) {

		Optional<TransactionHandler<?>> found = lookup_cache.computeIfAbsent(
			object.getClass(), this::findForClass );
		return ( TransactionHandler<? super T> ) found.orElse( null );
	}


	private Optional<TransactionHandler<?>> findForClass( Class<?> type ) {
		for( Class<?> c = type; c != null; c = c.getSuperclass() ) {
			TransactionHandler<?> handler = handlers.get( c );
			if ( handler != null ) return Optional.of( handler );
		}
		return Optional.empty();
	}


	private static final class GlobalHolder {
		static final HandlerRegistry INSTANCE = new HandlerRegistry();
	}
}
