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


/**
 * Handles transactions for a class of {@link LocalObject}.
 *
 * @see HandlerRegistry
 */
@FunctionalInterface
public interface TransactionHandler<T extends LocalObject> {
	/**
	 * Handle a transaction.
	 *
	 * @param target	The object the call is addressed to.
	 * @param code		Selector for the operation.
	 * @param data		Arguments, positioned at the start.
	 * @param reply		Parcel for the result. For one-way calls anything written is
	 * 					discarded.
	 * @param flags		Flags the call was made with.
	 *
	 * @return			{@link Status#OK}, {@link Status#UNKNOWN_TRANSACTION} for an
	 * 					unsupported code, or any other status which is passed back to
	 * 					the caller.
	 */
	int onTransact( @Nonnull T target, int code, @Nonnull Parcel data,
		@Nonnull Parcel reply, int flags );
}
