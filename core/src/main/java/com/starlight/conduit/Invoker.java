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
//     * Neither the name of Conduit nor the
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

import com.starlight.conduit.exception.DispatchException;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;


/**
 * Type-erased entry in the {@link FunctionRegistry}: knows how to encode arguments for a
 * method on the calling side and how to decode them, invoke the method and encode its
 * result on the serving side.
 */
interface Invoker {
	ExportedType<?> getType();

	Method getMethod();

	String getQualifiedName();


	/**
	 * Append one part per argument, in declaration order.
	 */
	void encodeArguments( @Nonnull Object[] args, @Nonnull RoleContext context,
		@Nonnull Envelope out ) throws IOException;


	/**
	 * Decode the arguments (consuming the remaining parts of the envelope) and invoke
	 * the method on the target.
	 *
	 * @return		The raw return value.
	 *
	 * @throws DispatchException			If the arguments can't be decoded or the
	 * 										method can't be invoked.
	 * @throws InvocationTargetException	If the method itself threw.
	 */
	Object invoke( @Nonnull Object target, @Nonnull Envelope arguments,
		@Nonnull RoleContext context )
		throws DispatchException, InvocationTargetException;


	byte[] encodeResult( Object result, @Nonnull RoleContext context ) throws IOException;

	Object decodeResult( @Nonnull byte[] frame, @Nonnull RoleContext context )
		throws IOException, ClassNotFoundException;
}
